/**
 * RunConfig.java
 *
 * 一次运行所使用的参数快照。
 * 由 ProfileService 在启动时从外部配置文件解析得到，之后不可变；
 * 运行期间对配置文件的修改只会影响下一次运行。
 */
package club.ppmc.launcher.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * @param profile          配置档案名称，仅用于展示和日志。
 * @param command          可执行文件及其参数。
 * @param environment      注入到子进程的环境变量（在继承的环境之上覆盖）。
 * @param workingDirectory 子进程的工作目录，为 null 时使用服务自身的工作目录。
 * @param gracePeriod      发送优雅停止信号后，强制终止前的等待时间。
 */
public record RunConfig(
        String profile,
        List<String> command,
        Map<String, String> environment,
        Path workingDirectory,
        Duration gracePeriod
) {}
