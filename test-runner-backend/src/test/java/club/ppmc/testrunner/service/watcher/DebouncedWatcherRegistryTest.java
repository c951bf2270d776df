package club.ppmc.testrunner.service.watcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import club.ppmc.testrunner.model.ServerMode;
import club.ppmc.testrunner.model.Settings;
import club.ppmc.testrunner.service.ServerModeTracker;
import club.ppmc.testrunner.service.SettingsService;
import club.ppmc.testrunner.util.Disposable;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DebouncedWatcherRegistryTest {

    private static final long DEBOUNCE_MILLIS = 200;
    private static final Path WORKSPACE = Path.of("/workspace");
    private static final Path DEMO_TESTS = WORKSPACE.resolve("demo/src/test/java");
    private static final Path LIB_TESTS = WORKSPACE.resolve("lib/src/test/java");

    private final ScheduledExecutorService debounceScheduler = Executors.newSingleThreadScheduledExecutor();
    private final ServerModeTracker modeTracker = new ServerModeTracker();
    private final RecordingWatcherFactory watcherFactory = new RecordingWatcherFactory();
    private TestSourcePathProvider pathProvider;
    private DebouncedWatcherRegistry registry;

    @BeforeEach
    void setUp() {
        Settings settings = new Settings();
        settings.setWatcherDebounceMillis(DEBOUNCE_MILLIS);
        SettingsService settingsService = mock(SettingsService.class);
        when(settingsService.getSettings()).thenReturn(settings);

        pathProvider = mock(TestSourcePathProvider.class);
        when(pathProvider.getWorkspaceRoot()).thenReturn(WORKSPACE);
        when(pathProvider.getTestSourceRoots()).thenReturn(List.of(DEMO_TESTS, LIB_TESTS));

        registry = new DebouncedWatcherRegistry(
                modeTracker, pathProvider, watcherFactory, mock(FileChangeListener.class), settingsService, debounceScheduler);
    }

    @AfterEach
    void tearDown() {
        registry.dispose();
        debounceScheduler.shutdownNow();
    }

    @Test
    void burstOfDebouncedCallsRebindsOnceAfterTheLastCall() throws InterruptedException {
        for (int i = 0; i < 5; i++) {
            registry.registerListeners(true);
            TimeUnit.MILLISECONDS.sleep(DEBOUNCE_MILLIS / 4);
        }
        assertThat(registry.getBindCount()).isZero();
        assertThat(registry.isDebouncePending()).isTrue();

        await().atMost(Duration.ofSeconds(2)).until(() -> registry.getBindCount() == 1);
        TimeUnit.MILLISECONDS.sleep(DEBOUNCE_MILLIS * 2);
        assertThat(registry.getBindCount()).isEqualTo(1);
        assertThat(registry.isDebouncePending()).isFalse();
    }

    @Test
    void immediateRebindCancelsPendingDebouncedRebind() throws InterruptedException {
        registry.registerListeners(true);
        registry.registerListeners(false);

        assertThat(registry.getBindCount()).isEqualTo(1);
        TimeUnit.MILLISECONDS.sleep(DEBOUNCE_MILLIS * 2);
        assertThat(registry.getBindCount()).isEqualTo(1);
    }

    @Test
    void modeSwitchDuringPendingClasspathRebindLeavesOneStandardSet() throws InterruptedException {
        modeTracker.set(ServerMode.LIGHT_WEIGHT);
        registry.registerListeners(false);
        assertThat(watcherFactory.liveRoots()).containsExactly(WORKSPACE);

        registry.registerListeners(true);
        modeTracker.set(ServerMode.STANDARD);
        registry.registerListeners(false);
        TimeUnit.MILLISECONDS.sleep(DEBOUNCE_MILLIS * 2);

        assertThat(registry.getBindCount()).isEqualTo(2);
        assertThat(registry.getBoundMode()).isEqualTo(ServerMode.STANDARD);
        assertThat(registry.getActiveWatcherCount()).isEqualTo(2);
        assertThat(watcherFactory.liveRoots()).containsExactly(DEMO_TESTS, LIB_TESTS);
    }

    @Test
    void bindsByServerMode() {
        modeTracker.set(ServerMode.STANDARD);
        registry.registerListeners(false);
        assertThat(watcherFactory.liveRoots()).containsExactly(DEMO_TESTS, LIB_TESTS);

        modeTracker.set(ServerMode.LIGHT_WEIGHT);
        registry.registerListeners(false);
        assertThat(watcherFactory.liveRoots()).containsExactly(WORKSPACE);

        modeTracker.set(ServerMode.HYBRID);
        registry.registerListeners(false);
        assertThat(watcherFactory.liveRoots()).isEmpty();
        assertThat(registry.getBoundMode()).isEqualTo(ServerMode.HYBRID);

        modeTracker.set(ServerMode.UNKNOWN);
        registry.registerListeners(false);
        assertThat(watcherFactory.liveRoots()).containsExactly(DEMO_TESTS, LIB_TESTS);
        assertThat(watcherFactory.created).allSatisfy(watch -> assertThat(watch.target.extension()).isEqualTo(".java"));
    }

    @Test
    void previousWatchersAreDisposedBeforeNewOnesAttach() {
        registry.registerListeners(false);
        registry.registerListeners(false);

        assertThat(watcherFactory.events).containsExactly(
                "watch " + DEMO_TESTS, "watch " + LIB_TESTS,
                "dispose " + DEMO_TESTS, "dispose " + LIB_TESTS,
                "watch " + DEMO_TESTS, "watch " + LIB_TESTS);
    }

    @Test
    void failingTargetDoesNotPreventTheOthers() {
        watcherFactory.failingRoot = DEMO_TESTS;

        registry.registerListeners(false);

        assertThat(watcherFactory.liveRoots()).containsExactly(LIB_TESTS);
        assertThat(registry.getActiveWatcherCount()).isEqualTo(1);
    }

    @Test
    void providerFailureBindsNothing() {
        when(pathProvider.getTestSourceRoots()).thenThrow(new java.io.UncheckedIOException(new java.io.IOException("denied")));

        registry.registerListeners(false);

        assertThat(registry.getActiveWatcherCount()).isZero();
        assertThat(registry.getBindCount()).isEqualTo(1);
    }

    @Test
    void disposeReleasesWatchersAndIgnoresLaterCalls() throws InterruptedException {
        registry.registerListeners(false);
        registry.registerListeners(true);

        registry.dispose();
        registry.registerListeners(false);
        TimeUnit.MILLISECONDS.sleep(DEBOUNCE_MILLIS * 2);

        assertThat(watcherFactory.liveRoots()).isEmpty();
        assertThat(registry.getActiveWatcherCount()).isZero();
        assertThat(registry.getBindCount()).isEqualTo(1);
    }

    @Test
    void concurrentCallsEndWithASingleWatcherSet() throws InterruptedException {
        Thread[] threads = new Thread[8];
        for (int i = 0; i < threads.length; i++) {
            boolean debounce = i % 2 == 0;
            threads[i] = new Thread(() -> registry.registerListeners(debounce));
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }
        await().atMost(Duration.ofSeconds(2)).until(() -> !registry.isDebouncePending());

        assertThat(watcherFactory.liveRoots()).containsExactly(DEMO_TESTS, LIB_TESTS);
    }

    private static final class RecordingWatcherFactory implements FileWatcherFactory {

        final List<RecordedWatch> created = new CopyOnWriteArrayList<>();
        final List<String> events = new CopyOnWriteArrayList<>();
        volatile Path failingRoot;

        @Override
        public Disposable watch(WatchTarget target, FileChangeListener listener) {
            if (target.root().equals(failingRoot)) {
                throw new IllegalStateException("cannot watch " + target.root());
            }
            var watch = new RecordedWatch(target, events);
            created.add(watch);
            events.add("watch " + target.root());
            return watch;
        }

        List<Path> liveRoots() {
            return created.stream().filter(watch -> !watch.disposed.get()).map(watch -> watch.target.root()).toList();
        }
    }

    private static final class RecordedWatch implements Disposable {

        final WatchTarget target;
        final List<String> events;
        final AtomicBoolean disposed = new AtomicBoolean();

        RecordedWatch(WatchTarget target, List<String> events) {
            this.target = target;
            this.events = events;
        }

        @Override
        public void dispose() {
            if (disposed.compareAndSet(false, true)) {
                events.add("dispose " + target.root());
            }
        }
    }
}
