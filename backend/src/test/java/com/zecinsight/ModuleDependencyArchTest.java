package com.zecinsight;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: engines below services, services below the HTTP surface, no cycles between features.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.zecinsight");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.zecinsight.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.zecinsight.domain..", "com.zecinsight.config..", "com.zecinsight.api..",
                        "com.zecinsight.scoring..", "com.zecinsight.analytics..", "com.zecinsight.monetization..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.zecinsight.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.zecinsight.api..", "com.zecinsight.scoring..", "com.zecinsight.analytics..",
                        "com.zecinsight.benchmark..", "com.zecinsight.comparison..", "com.zecinsight.privacy..",
                        "com.zecinsight.monetization..", "com.zecinsight.alert..", "com.zecinsight.insight..",
                        "com.zecinsight.task..", "com.zecinsight.performance..", "com.zecinsight.dashboard..",
                        "com.zecinsight.indexer..", "com.zecinsight.shielded..");
        rule.check(classes);
    }

    @Test
    void scoring_must_not_depend_on_higher_level_features() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.zecinsight.scoring..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.zecinsight.api..", "com.zecinsight.analytics..", "com.zecinsight.insight..",
                        "com.zecinsight.performance..", "com.zecinsight.dashboard..", "com.zecinsight.indexer..");
        rule.check(classes);
    }

    @Test
    void monetization_must_not_depend_on_analytics_or_api() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.zecinsight.monetization..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.zecinsight.api..", "com.zecinsight.analytics..", "com.zecinsight.dashboard..");
        rule.check(classes);
    }

    @Test
    void features_must_not_depend_on_api() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage(
                        "com.zecinsight.dashboard..", "com.zecinsight.indexer..", "com.zecinsight.insight..",
                        "com.zecinsight.alert..", "com.zecinsight.performance..", "com.zecinsight.shielded..")
                .should().dependOnClassesThat().resideInAPackage("com.zecinsight.api..");
        rule.check(classes);
    }

    @Test
    void nothing_depends_on_indexer() {
        ArchRule rule = noClasses()
                .that().resideOutsideOfPackage("com.zecinsight.indexer..")
                .should().dependOnClassesThat().resideInAPackage("com.zecinsight.indexer..");
        rule.check(classes);
    }

    @Test
    void api_should_not_import_repository_classes() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.zecinsight.api..")
                .should().dependOnClassesThat().haveSimpleNameEndingWith("Repository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.zecinsight.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
