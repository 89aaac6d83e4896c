package com.fieldinsight.reporting.core.relationship;

import com.fieldinsight.reporting.core.model.JoinKind;

/**
 * 业务实体关系：项目 -> 站点 -> 提交 -> 观测
 */
public final class DomainEntityGraph {

    public static final String PROGRAMS = "pilot_programs";
    public static final String SITES = "sites";
    public static final String SUBMISSIONS = "submissions";
    public static final String PETRI_OBSERVATIONS = "petri_observations";
    public static final String GASIFIER_OBSERVATIONS = "gasifier_observations";

    private DomainEntityGraph() {
    }

    public static EntityGraph create() {
        return EntityGraph.builder()
                // 观测 -> 提交 -> 站点 -> 项目 为主干，优先级最高
                .relate(PETRI_OBSERVATIONS, SUBMISSIONS, "submission_id", "submission_id", JoinKind.LEFT, 10)
                .relate(GASIFIER_OBSERVATIONS, SUBMISSIONS, "submission_id", "submission_id", JoinKind.LEFT, 10)
                .relate(SUBMISSIONS, SITES, "site_id", "site_id", JoinKind.LEFT, 10)
                .relate(SITES, PROGRAMS, "program_id", "program_id", JoinKind.LEFT, 10)
                // 观测表上冗余的站点/项目外键
                .relate(PETRI_OBSERVATIONS, SITES, "site_id", "site_id", JoinKind.LEFT, 20)
                .relate(GASIFIER_OBSERVATIONS, SITES, "site_id", "site_id", JoinKind.LEFT, 20)
                .relate(PETRI_OBSERVATIONS, PROGRAMS, "program_id", "program_id", JoinKind.LEFT, 30)
                .relate(GASIFIER_OBSERVATIONS, PROGRAMS, "program_id", "program_id", JoinKind.LEFT, 30)
                .relate(SUBMISSIONS, PROGRAMS, "program_id", "program_id", JoinKind.LEFT, 30)
                .build();
    }
}
