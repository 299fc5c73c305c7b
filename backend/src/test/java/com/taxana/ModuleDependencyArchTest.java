package com.taxana;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Keeps package boundaries: the ledger and the tax engine stay free of infrastructure wiring,
 * and price/FX lookup never reaches back into tax logic.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.taxana");
    }

    @Test
    void common_must_not_depend_on_other_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.taxana.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.taxana.domain..", "com.taxana.config..",
                        "com.taxana.costbasis..", "com.taxana.pricing..", "com.taxana.fx..", "com.taxana.tax..");
        rule.check(classes);
    }

    @Test
    void domain_must_only_depend_on_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.taxana.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.taxana.config..",
                        "com.taxana.costbasis..", "com.taxana.pricing..", "com.taxana.fx..", "com.taxana.tax..");
        rule.check(classes);
    }

    @Test
    void costbasis_must_only_depend_on_domain_and_common() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.taxana.costbasis..")
                .should().dependOnClassesThat().resideInAnyPackage("com.taxana.config..",
                        "com.taxana.pricing..", "com.taxana.fx..", "com.taxana.tax..");
        rule.check(classes);
    }

    @Test
    void pricing_must_not_depend_on_tax_costbasis_fx() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.taxana.pricing..")
                .should().dependOnClassesThat().resideInAnyPackage("com.taxana.tax..", "com.taxana.costbasis..",
                        "com.taxana.fx..");
        rule.check(classes);
    }

    @Test
    void fx_must_not_depend_on_tax_costbasis_pricing() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.taxana.fx..")
                .should().dependOnClassesThat().resideInAnyPackage("com.taxana.tax..", "com.taxana.costbasis..",
                        "com.taxana.pricing..");
        rule.check(classes);
    }

    @Test
    void tax_must_not_depend_on_app_config() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.taxana.tax..")
                .should().dependOnClassesThat().resideInAPackage("com.taxana.config..");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.taxana.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
