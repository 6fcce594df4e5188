package com.dotprint.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the layering of dotprint-core.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>The printing engine knows nothing about attributes, graphs or I/O</li>
 *   <li>Color scheme identities form a leaf package</li>
 *   <li>Model types are immutable records</li>
 *   <li>Output targets live in the impl package and implement the SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.dotprint.core");
    }

    @Test
    void printing_shouldNotDependOnHigherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.printing..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.attributes..",
                "..core.model..",
                "..core.generator..",
                "..core.definition..",
                "..core.config..",
                "..core.output..");

        rule.check(classes);
    }

    @Test
    void colorscheme_shouldNotDependOnOtherProjectPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.colorscheme..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.printing..",
                "..core.attributes..",
                "..core.model..",
                "..core.generator..",
                "..core.definition..",
                "..core.config..",
                "..core.output..");

        rule.check(classes);
    }

    @Test
    void printing_shouldNotLog() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.printing..")
            .should().dependOnClassesThat().resideInAPackage("org.slf4j..");

        rule.check(classes);
    }

    @Test
    void model_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..core.model..")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void outputTargets_shouldResideInImplAndImplementSpi() {
        ArchRule rule = classes()
            .that().haveSimpleNameEndingWith("Target")
            .and().areNotInterfaces()
            .should().resideInAPackage("..output.impl..")
            .andShould().implement("com.dotprint.core.output.OutputTarget");

        rule.check(classes);
    }

    @Test
    void definitionLayer_shouldNotBeUsedByGenerator() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.generator..")
            .should().dependOnClassesThat().resideInAnyPackage("..core.definition..", "..core.output..");

        rule.check(classes);
    }
}
