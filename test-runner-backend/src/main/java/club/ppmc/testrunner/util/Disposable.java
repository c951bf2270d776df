/**
 * Disposable.java
 *
 * 可释放资源的统一抽象：文件监听器句柄、事件订阅、调试器附加等都通过它释放。
 * dispose() 必须是幂等的。
 */
package club.ppmc.testrunner.util;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@FunctionalInterface
public interface Disposable {

    void dispose();

    /**
     * 依次释放列表中的所有资源。单个资源释放失败不会阻止其余资源的释放，失败会被记录。
     *
     * @return 释放失败的数量。
     */
    static int disposeAll(List<? extends Disposable> disposables) {
        Logger logger = LoggerFactory.getLogger(Disposable.class);
        int failures = 0;
        for (Disposable disposable : new ArrayList<>(disposables)) {
            try {
                disposable.dispose();
            } catch (RuntimeException e) {
                failures++;
                logger.error("释放资源 {} 时出错", disposable, e);
            }
        }
        return failures;
    }
}
