/**
 * DefaultProcessLauncher.java
 *
 * ProcessLauncher 的默认实现，直接使用 ProcessBuilder 创建操作系统进程。
 * 命令以列表形式传入，避免路径中的空格导致解析问题。
 */
package club.ppmc.launcher.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public Process launch(List<String> command, Map<String, String> environment, Path workingDirectory)
            throws IOException {
        var processBuilder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            processBuilder.directory(workingDirectory.toFile());
        }
        processBuilder.environment().putAll(environment);
        // 标准输出和标准错误分别读取，以便区分日志来源
        processBuilder.redirectErrorStream(false);

        log.debug("在目录 {} 中启动进程: {}", workingDirectory, String.join(" ", command));
        return processBuilder.start();
    }
}
