/**
 * FileChangeListener.java
 *
 * 文件监听回调。只关心修改和删除；新建的文件由重新发现测试项的流程处理。
 */
package club.ppmc.testrunner.service.watcher;

import java.nio.file.Path;

public interface FileChangeListener {

    void onChanged(Path file);

    void onDeleted(Path file);
}
