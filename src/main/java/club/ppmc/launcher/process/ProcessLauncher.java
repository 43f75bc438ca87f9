/**
 * ProcessLauncher.java
 *
 * 对 ProcessBuilder 的一层抽象，使 ManagedProcess 可以在测试中替换进程的创建方式。
 * 生产环境使用 DefaultProcessLauncher。
 */
package club.ppmc.launcher.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public interface ProcessLauncher {

    /**
     * 启动一个新进程。
     *
     * @param command          可执行文件及其参数。
     * @param environment      在继承的环境变量之上额外注入的变量。
     * @param workingDirectory 工作目录，可以为 null。
     * @return 已启动的进程，标准输出与标准错误保持分离。
     * @throws IOException 如果进程无法启动。
     */
    Process launch(List<String> command, Map<String, String> environment, Path workingDirectory)
            throws IOException;
}
