package com.fieldinsight.reporting.core.optimizer;

import com.fieldinsight.reporting.core.model.DataSource;
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
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * 隐式过滤注入
 * 把执行上下文（公司、可访问项目、默认项目、默认时间窗口）转换为作用在主数据源上的过滤条件，
 * 这些条件参与查询构建、分区优化和缓存Key计算
 */
@ApplicationScoped
public class ImplicitFilterInjector {

    private static final Logger log = LoggerFactory.getLogger(ImplicitFilterInjector.class);

    static final String ID_PREFIX = "implicit:";

    @ConfigProperty(name = "report.implicit.company-field", defaultValue = "company_id")
    String companyField;

    @ConfigProperty(name = "report.implicit.date-field", defaultValue = "created_at")
    String dateField;

    @Inject
    PartitionCatalog catalog;

    @Inject
    Clock clock;

    public List<Filter> derive(ReportConfiguration config, ExecutionContext context) {
        List<Filter> implicit = new ArrayList<>();
        if (context == null) {
            return implicit;
        }
        DataSource primary = config.primaryDataSource();
        List<Filter> explicit = new ArrayList<>(primary.baseFilters());
        explicit.addAll(config.filters());

        if (context.companyId() != null) {
            implicit.add(Filter.of(companyField, FilterOperator.EQUALS, context.companyId())
                    .withId(ID_PREFIX + "company"));
        }
        if (!context.allowedProgramIds().isEmpty()) {
            implicit.add(Filter.of(catalog.keyField(), FilterOperator.IN, context.allowedProgramIds())
                    .withId(ID_PREFIX + "allowed-programs"));
        }
        if (context.defaultProgramId() != null && !hasProgramFilter(explicit, primary)) {
            implicit.add(Filter.of(catalog.keyField(), FilterOperator.EQUALS, context.defaultProgramId())
                    .withId(ID_PREFIX + "default-program"));
        }
        Integer days = context.defaultDateRangeDays();
        if (days != null && days > 0 && !hasDateRange(explicit, primary)) {
            // 截断到当天零点，同一天内的缓存Key保持稳定
            Instant since = LocalDate.now(clock.withZone(ZoneOffset.UTC))
                    .minusDays(days)
                    .atStartOfDay(ZoneOffset.UTC)
                    .toInstant();
            implicit.add(Filter.of(dateField, FilterOperator.GREATER_THAN_OR_EQUAL, since.toString())
                    .withId(ID_PREFIX + "default-date-range"));
        }

        if (!implicit.isEmpty()) {
            log.debug("[ImplicitFilter] Report {}: {} implicit filter(s) for company {}",
                    config.id(), implicit.size(), context.companyId());
        }
        return implicit;
    }

    private boolean hasProgramFilter(List<Filter> filters, DataSource primary) {
        return filters.stream()
                .anyMatch(f -> onPrimary(f, primary) && f.field().equals(catalog.keyField()));
    }

    private boolean hasDateRange(List<Filter> filters, DataSource primary) {
        return filters.stream()
                .anyMatch(f -> onPrimary(f, primary)
                        && (f.field().equals(dateField) || catalog.rangeFields().contains(f.field()))
                        && (f.operator().isComparison() || f.operator() == FilterOperator.BETWEEN));
    }

    private static boolean onPrimary(Filter filter, DataSource primary) {
        return !filter.hasRelationshipPath()
                && (filter.dataSource() == null || filter.dataSource().equals(primary.id()));
    }
}
