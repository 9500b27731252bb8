package com.growfolio.dataclient;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.growfolio", importOptions = ImportOption.DoNotIncludeTests.class)
public class ArchitectureTest {
    @ArchTest
    static final ArchRule services_should_be_in_service_package = classes().that().haveSimpleNameEndingWith("Service").should().resideInAPackage("..service..");

    @ArchTest
    static final ArchRule repositories_should_not_access_config = noClasses().that().resideInAPackage("..repository..").should().dependOnClassesThat().resideInAPackage("..config..");

    @ArchTest
    static final ArchRule remote_should_not_access_repositories = noClasses().that().resideInAPackage("..remote..").should().dependOnClassesThat().resideInAPackage("..repository..");

    @ArchTest
    static final ArchRule sync_core_should_not_depend_on_spring = noClasses().that().resideInAPackage("com.growfolio.synccore..").should().dependOnClassesThat().resideInAPackage("org.springframework..");

    @ArchTest
    static final ArchRule sync_core_should_not_know_domains = noClasses().that().resideInAPackage("com.growfolio.synccore..").should().dependOnClassesThat().resideInAPackage("com.growfolio.dataclient..");
}
