package com.tanumd.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * ArchUnit tests to validate package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>Utilities and models stay free of container logic</li>
 *   <li>The codec is the only package that touches the ZIP library</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.tanumd.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     * {@code ArchiveLayout} only holds entry name constants.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().doNotHaveSimpleName("ArchiveLayout")
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void utilClasses_shouldNotDependOnContainerPackages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..attachment..", "..db..", "..codec..", "..document..", "..workspace..", "..config..");

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnImplementations() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..attachment..", "..db..", "..codec..", "..document..", "..workspace..");

        rule.check(classes);
    }

    /**
     * Verifies the ZIP library is confined to the codec, so the archive layout has one owner.
     */
    @Test
    void zipLibrary_shouldOnlyBeUsedByCodec() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..codec..")
            .should().dependOnClassesThat().resideInAPackage("org.apache.commons.compress..");

        rule.check(classes);
    }

    @Test
    void documentAndStores_shouldNotDependOnCodec() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..document..", "..attachment..", "..db..", "..workspace..")
            .should().dependOnClassesThat().resideInAPackage("..codec..");

        rule.check(classes);
    }
}
