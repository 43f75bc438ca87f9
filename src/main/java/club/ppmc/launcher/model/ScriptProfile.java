/**
 * ScriptProfile.java
 *
 * 外部配置文件 profiles.json 中的一个运行档案。
 * 它是一个可变的POJO，便于 Jackson 进行序列化和反序列化；
 * 启动运行时由 ProfileService 转换为不可变的 RunConfig 快照。
 */
package club.ppmc.launcher.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScriptProfile {

    /**
     * 要执行的命令及其参数，例如 ["python3", "-u", "launcher.py"]。
     */
    private List<String> command = new ArrayList<>();

    /**
     * 工作目录。相对路径以数据目录为基准。为空时使用数据目录。
     */
    private String workingDirectory;

    /**
     * 额外注入的环境变量。值可以是字符串、数字或布尔值，null 值会被跳过。
     */
    private Map<String, Object> environment = new LinkedHashMap<>();

    /**
     * (可选) 一个扁平的键值JSON文件，启动时读取并作为环境变量注入，覆盖 environment 中的同名项。
     */
    private String environmentFile;

    /**
     * 启动前必须存在且非空的文件列表。
     */
    private List<String> requiredFiles = new ArrayList<>();

    /**
     * 停止时的优雅等待秒数。为空时使用全局配置。
     */
    private Integer gracePeriodSeconds;
}
