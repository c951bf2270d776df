package club.ppmc.testrunner.service.analysis;

import club.ppmc.testrunner.util.Disposable;
import java.net.URI;
import java.util.List;
import java.util.function.Consumer;

/**
 * 项目导入完成的通知，参数为导入的项目根目录。
 */
public interface ProjectsImportEvents extends AnalysisServiceApi {

    Disposable onProjectsImport(Consumer<List<URI>> listener);
}
