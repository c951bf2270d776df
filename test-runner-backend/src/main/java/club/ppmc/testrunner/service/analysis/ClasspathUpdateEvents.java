package club.ppmc.testrunner.service.analysis;

import club.ppmc.testrunner.util.Disposable;

/**
 * 项目类路径发生变化时的通知。
 */
public interface ClasspathUpdateEvents extends AnalysisServiceApi {

    Disposable onClasspathUpdate(Runnable listener);
}
