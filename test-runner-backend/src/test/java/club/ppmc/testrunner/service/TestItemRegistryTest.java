package club.ppmc.testrunner.service;

import static club.ppmc.testrunner.SampleItems.caseIn;
import static club.ppmc.testrunner.SampleItems.suite;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.testrunner.exception.UnknownTestItemException;
import club.ppmc.testrunner.model.TestItem;
import club.ppmc.testrunner.model.TestKind;
import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TestItemRegistryTest {

    private static final Path ALPHA = Path.of("/workspace/demo/src/test/java/com/example/AlphaTest.java");
    private static final Path BETA = Path.of("/workspace/demo/src/test/java/com/example/BetaTest.java");

    private final TestItemRegistry registry = new TestItemRegistry();

    @Test
    void registeringAFileAgainReplacesItsItems() {
        registry.register(List.of(suite("AlphaTest", ALPHA), caseIn("alphaOne", ALPHA), suite("BetaTest", BETA)));

        registry.register(List.of(suite("AlphaTest", ALPHA), caseIn("alphaTwo", ALPHA)));

        assertThat(registry.findByUri(ALPHA.toUri())).extracting(TestItem::id).containsExactly("AlphaTest", "alphaTwo");
        assertThat(registry.findById("alphaOne")).isEmpty();
        assertThat(registry.findById("BetaTest")).isPresent();
    }

    @Test
    void fileUrisAreMatchedRegardlessOfSpelling() {
        registry.register(List.of(suite("AlphaTest", ALPHA)));

        URI spelledDifferently = URI.create("file:/workspace/demo/src/test/java/com/example/../example/AlphaTest.java");

        assertThat(registry.findByUri(spelledDifferently)).hasSize(1);
    }

    @Test
    void removeByUriDropsAllItemsOfTheFile() {
        registry.register(List.of(suite("AlphaTest", ALPHA), caseIn("alphaOne", ALPHA), suite("BetaTest", BETA)));

        List<TestItem> removed = registry.removeByUri(ALPHA.toUri());

        assertThat(removed).extracting(TestItem::id).containsExactly("AlphaTest", "alphaOne");
        assertThat(registry.all()).extracting(TestItem::id).containsExactly("BetaTest");
        assertThat(registry.removeByUri(ALPHA.toUri())).isEmpty();
    }

    @Test
    void requireFailsForUnknownId() {
        assertThatThrownBy(() -> registry.require("missing")).isInstanceOf(UnknownTestItemException.class);
    }

    @Test
    void runAllPrefersSuitesSortedById() {
        registry.register(List.of(suite("BetaTest", BETA), caseIn("alphaOne", ALPHA), suite("AlphaTest", ALPHA)));

        assertThat(registry.runAllTargets()).extracting(TestItem::id).containsExactly("AlphaTest", "BetaTest");
    }

    @Test
    void runAllFallsBackToCasesWithoutSuites() {
        registry.register(List.of(caseIn("alphaOne", ALPHA)));

        assertThat(registry.runAllTargets()).extracting(TestItem::id).containsExactly("alphaOne");
    }

    @Test
    void findByFullNamePrefersTheRequestedProjects() {
        TestItem other = new TestItem("other@AlphaTest", "AlphaTest", TestKind.SUITE, "other",
                "com.example.AlphaTest", URI.create("file:///workspace/other/src/test/java/com/example/AlphaTest.java"), null);
        registry.register(List.of(other, suite("AlphaTest", ALPHA)));

        assertThat(registry.findByFullName(Set.of("demo"), "com.example.AlphaTest"))
                .map(TestItem::id).contains("AlphaTest");
        assertThat(registry.findByFullName(Set.of("other"), "com.example.AlphaTest"))
                .map(TestItem::id).contains("other@AlphaTest");
        assertThat(registry.findByFullName(Set.of("demo"), "com.example.Missing")).isEmpty();
    }
}
