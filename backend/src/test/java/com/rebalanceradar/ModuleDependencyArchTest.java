package com.rebalanceradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: the canonical state model knows nothing of how it is fed, and readers never
 * reach into the ingestion machinery.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.rebalanceradar");
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..domain..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..config..", "..notification..", "..query..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..common..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..ingestion..", "..config..", "..notification..", "..query..");
        rule.check(classes);
    }

    @Test
    void notification_must_not_depend_on_ingestion_domain_query() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..notification..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion..", "..domain..", "..query..");
        rule.check(classes);
    }

    @Test
    void query_must_not_depend_on_readers_or_reducer() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..query..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.job..", "..ingestion.reducer..", "..ingestion.adapter..");
        rule.check(classes);
    }

    @Test
    void ingestion_event_must_be_self_contained() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.event..")
                .should().dependOnClassesThat().resideInAnyPackage("..domain..", "..notification..", "..ingestion.adapter..",
                        "..ingestion.queue..", "..ingestion.reducer..", "..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void ingestion_adapter_must_not_depend_on_queue_reducer_job() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.adapter..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.queue..", "..ingestion.reducer..", "..ingestion.job..");
        rule.check(classes);
    }

    @Test
    void ingestion_reducer_must_not_depend_on_chain_readers() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..ingestion.reducer..")
                .should().dependOnClassesThat().resideInAnyPackage("..ingestion.adapter..", "..ingestion.job..", "..ingestion.queue..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.rebalanceradar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
