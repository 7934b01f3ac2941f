package com.statementradar;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: domain and common are leaves, each stage only sees the stages before it,
 * and pipeline is the only place that wires classification, extraction and consolidation together.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.statementradar");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.statementradar.domain..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..classification..", "..extraction..", "..consolidation..", "..export..",
                        "..pipeline..", "com.statementradar.config..");
        rule.check(classes);
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.statementradar.common..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "com.statementradar.domain..", "..classification..", "..extraction..",
                        "..consolidation..", "..export..", "..pipeline..", "com.statementradar.config..");
        rule.check(classes);
    }

    @Test
    void classification_must_not_depend_on_later_stages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..classification..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..extraction..", "..consolidation..", "..export..", "..pipeline..");
        rule.check(classes);
    }

    @Test
    void extraction_must_not_depend_on_classification_internals_or_later_stages() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..extraction..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..classification..", "..consolidation..", "..export..", "..pipeline..");
        rule.check(classes);
    }

    @Test
    void consolidation_must_not_depend_on_extraction_or_pipeline() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..consolidation..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..classification..", "..extraction..", "..export..", "..pipeline..");
        rule.check(classes);
    }

    @Test
    void export_must_only_depend_on_domain() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("..export..")
                .should().dependOnClassesThat().resideInAnyPackage(
                        "..classification..", "..extraction..", "..consolidation..", "..pipeline..",
                        "com.statementradar.config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.statementradar.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
