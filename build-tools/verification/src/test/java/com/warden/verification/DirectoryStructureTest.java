package com.warden.verification;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Repository layout checks. They run with the normal build so that a moved module or a stray build
 * system fails fast.
 */
@DisplayName("Repository directory structure")
class DirectoryStructureTest {

    private static Path projectRoot;
    private static String rootPom;

    @BeforeAll
    static void resolveProjectRoot() throws IOException {
        // Maven runs tests with CWD = module directory (build-tools/verification)
        projectRoot = Path.of(System.getProperty("user.dir")).getParent().getParent();
        assertThat(projectRoot.resolve("pom.xml"))
                .as("Root pom.xml must exist at project root: %s", projectRoot)
                .exists();
        rootPom = Files.readString(projectRoot.resolve("pom.xml"));
    }

    @Nested
    @DisplayName("Root build")
    class RootBuild {

        @Test
        @DisplayName("root pom aggregates every module")
        void listsModules() {
            assertThat(rootPom).contains(
                    "<module>libs/event-model</module>",
                    "<module>libs/observability</module>",
                    "<module>libs/security</module>",
                    "<module>libs/scope</module>",
                    "<module>services/authz-service</module>",
                    "<module>build-tools/verification</module>");
        }

        @Test
        @DisplayName("root pom targets Java 17")
        void targetsJava17() {
            assertThat(rootPom).contains("<maven.compiler.release>17</maven.compiler.release>");
        }

        @Test
        @DisplayName("no second build system is present")
        void mavenOnly() throws IOException {
            try (Stream<Path> files = Files.walk(projectRoot, 3)) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .noneMatch(name -> name.endsWith(".gradle") || name.endsWith(".gradle.kts")
                                || name.equals("BUILD.bazel") || name.equals("build.xml"));
            }
        }
    }

    @Nested
    @DisplayName("Modules")
    class Modules {

        @ParameterizedTest(name = "{0} has pom and package {1}")
        @CsvSource({
            "libs/event-model, com/warden/eventmodel",
            "libs/observability, com/warden/observability",
            "libs/security, com/warden/security",
            "libs/scope, com/warden/scope",
            "services/authz-service, com/warden/authzservice"
        })
        void moduleLayout(String module, String packagePath) {
            Path dir = projectRoot.resolve(module);
            assertThat(dir.resolve("pom.xml")).isRegularFile();
            assertThat(dir.resolve("src/main/java").resolve(packagePath)).isDirectory();
            assertThat(dir.resolve("src/test/java").resolve(packagePath)).isDirectory();
        }

        @Test
        @DisplayName("the service ships its configuration and role catalog")
        void serviceResources() {
            Path resources = projectRoot.resolve("services/authz-service/src/main/resources");
            assertThat(resources.resolve("application.yml")).isRegularFile();
            assertThat(resources.resolve("rbac.yaml")).isRegularFile();
            assertThat(resources.resolve("logback-spring.xml")).isRegularFile();
        }
    }
}
