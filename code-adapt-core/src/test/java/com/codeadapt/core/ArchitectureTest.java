package com.codeadapt.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate the layering of the adaptation pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are implemented as immutable records</li>
 *   <li>The AST does not know about the stages that consume it</li>
 *   <li>Transformation passes share one interface</li>
 *   <li>Lower layers never depend on the adapter facade</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.codeadapt.core");
    }

    /**
     * Verifies all domain models in the model package are implemented as Java records.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Verifies the model layer has no dependencies on the pipeline stages.
     */
    @Test
    void models_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..transform..", "..adapter..", "..catalog..", "..plan..", "..analysis..", "..parser..");

        rule.check(classes);
    }

    @Test
    void ast_shouldNotDependOnConsumers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..transform..", "..generator..", "..analysis..", "..catalog..", "..model..");

        rule.check(classes);
    }

    /**
     * Verifies every pass in the transform package implements TransformationPass.
     */
    @Test
    void passes_shouldImplementTransformationPass() {
        ArchRule rule = classes()
            .that().resideInAPackage("..transform..")
            .and().haveSimpleNameEndingWith("Pass")
            .should().beAssignableTo("com.codeadapt.core.transform.TransformationPass");

        rule.check(classes);
    }

    /**
     * Verifies utility classes stay free of pipeline dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnPipelineStages() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..transform..", "..adapter..", "..catalog..", "..plan..", "..directive..");

        rule.check(classes);
    }

    @Test
    void onlyAdapter_shouldDependOnAdapter() {
        ArchRule rule = noClasses()
            .that().resideOutsideOfPackage("..adapter..")
            .should().dependOnClassesThat().resideInAPackage("..adapter..");

        rule.check(classes);
    }

    @Test
    void transformer_shouldNotDependOnPlanning() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..transform..")
            .should().dependOnClassesThat().resideInAnyPackage("..plan..", "..catalog..", "..adapter..");

        rule.check(classes);
    }
}
