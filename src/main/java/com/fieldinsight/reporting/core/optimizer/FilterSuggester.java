package com.fieldinsight.reporting.core.optimizer;

import com.fieldinsight.reporting.core.model.ExecutionContext;
import com.fieldinsight.reporting.core.model.Filter;
import com.fieldinsight.reporting.core.model.FilterOperator;
import com.fieldinsight.reporting.core.model.ReportConfiguration;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * 建议过滤
 * 报表缺少项目过滤时建议上下文中最近使用的项目，缺少时间过滤时建议最近30天
 */
@ApplicationScoped
public class FilterSuggester {

    private static final Logger log = LoggerFactory.getLogger(FilterSuggester.class);

    static final String ID_PREFIX = "suggested:";
    static final int RECENT_DAYS = 30;

    @ConfigProperty(name = "report.implicit.date-field", defaultValue = "created_at")
    public String dateField;

    @Inject
    public PartitionCatalog catalog;

    @Inject
    public Clock clock;

    /**
     * @param implicitFilters 已注入的隐式过滤，视同已有过滤
     */
    public List<Filter> suggest(ReportConfiguration config, List<Filter> implicitFilters, ExecutionContext context) {
        List<Filter> existing = new ArrayList<>(config.primaryDataSource().baseFilters());
        existing.addAll(config.filters());
        existing.addAll(implicitFilters);

        List<Filter> suggested = new ArrayList<>();
        String recentProgram = recentProgram(context);
        if (recentProgram != null && !hasField(existing, catalog.keyField())) {
            suggested.add(Filter.of(catalog.keyField(), FilterOperator.EQUALS, recentProgram)
                    .withId(ID_PREFIX + "program"));
        }
        if (!hasField(existing, dateField) && catalog.rangeFields().stream().noneMatch(f -> hasField(existing, f))) {
            // 截断到当天零点，同一天内的建议保持不变
            String since = LocalDate.now(clock.withZone(ZoneOffset.UTC))
                    .minusDays(RECENT_DAYS)
                    .atStartOfDay(ZoneOffset.UTC)
                    .toInstant()
                    .toString();
            suggested.add(Filter.of(dateField, FilterOperator.GREATER_THAN, since)
                    .withId(ID_PREFIX + "last-30-days"));
        }
        if (!suggested.isEmpty()) {
            log.debug("[Suggest] Report {}: {} suggested filter(s)", config.id(), suggested.size());
        }
        return suggested;
    }

    /**
     * 默认项目优先，其次可访问项目中的第一个
     */
    private static String recentProgram(ExecutionContext context) {
        if (context == null) {
            return null;
        }
        if (context.defaultProgramId() != null) {
            return context.defaultProgramId();
        }
        return context.allowedProgramIds().isEmpty() ? null : context.allowedProgramIds().get(0);
    }

    private static boolean hasField(List<Filter> filters, String field) {
        return filters.stream().anyMatch(f -> f.field().equals(field));
    }
}
