package dev.shortlist.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.shortlist", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The document store port and its adapter know nothing about retrieval
    @ArchTest
    static final ArchRule corpus_should_not_depend_on_search =
        noClasses().that().resideInAPackage("..corpus..")
            .should().dependOnClassesThat().resideInAPackage("..search..");

    // Retrieval core is framework-agnostic apart from its Spring entry points
    @ArchTest
    static final ArchRule scoring_and_fusion_should_not_depend_on_spring =
        noClasses().that().resideInAPackage("dev.shortlist.search")
            .and().doNotHaveSimpleName("RetrievalService")
            .and().doNotHaveSimpleName("RetrievalProperties")
            .should().dependOnClassesThat().resideInAPackage("org.springframework..");

    // Features should not depend on wiring
    @ArchTest
    static final ArchRule features_should_not_depend_on_config =
        noClasses().that().resideInAnyPackage("..search..", "..corpus..")
            .should().dependOnClassesThat().resideInAPackage("..config..");

    // Evaluation sits on top of the pipeline, never the other way round
    @ArchTest
    static final ArchRule search_should_not_depend_on_eval =
        noClasses().that().resideInAPackage("dev.shortlist.search")
            .should().dependOnClassesThat().resideInAPackage("..eval..");

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.shortlist.(*)..").should().beFreeOfCycles();
}
