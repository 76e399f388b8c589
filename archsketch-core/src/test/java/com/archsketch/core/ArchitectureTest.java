package com.archsketch.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate architectural rules and design patterns.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Extractors extend the shared base class</li>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Base classes don't depend on implementations</li>
 *   <li>Traversal and rule tables stay independent of the extraction layer</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.archsketch.core");
    }

    @Test
    void extractors_shouldExtendAbstractExtractor() {
        ArchRule rule = classes()
            .that().resideInAPackage("..extractor.impl..")
            .and().haveSimpleNameEndingWith("Extractor")
            .and().doNotHaveSimpleName("InterfaceExtractor")
            .should().beAssignableTo("com.archsketch.core.extractor.base.AbstractExtractor");

        rule.check(classes);
    }

    @Test
    void profiles_shouldImplementAnalysisProfile() {
        ArchRule rule = classes()
            .that().resideInAPackage("..aggregation.impl..")
            .and().haveSimpleNameEndingWith("Profile")
            .should().implement("com.archsketch.core.aggregation.AnalysisProfile");

        rule.check(classes);
    }

    /**
     * Verifies all domain models are records. Enums and the document interface are exempt.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().areNotInterfaces()
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void baseExtractors_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..extractor.base..")
            .should().dependOnClassesThat().resideInAPackage("..extractor.impl..");

        rule.check(classes);
    }

    @Test
    void walkerAndRules_shouldNotDependOnExtractors() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..walker..", "..rules..", "..classifier..")
            .should().dependOnClassesThat().resideInAnyPackage("..extractor..", "..aggregation..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnOtherLayers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..extractor..", "..aggregation..", "..generator..", "..renderer..", "..io..", "..config..");

        rule.check(classes);
    }
}
