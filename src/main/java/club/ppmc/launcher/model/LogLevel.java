/**
 * LogLevel.java
 *
 * 日志记录的分类级别。由 LogClassifier 根据行文本匹配配置的标记得出，
 * 在 JSON 中以小写形式输出，便于前端直接用作样式名。
 */
package club.ppmc.launcher.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;

public enum LogLevel {
    @JsonProperty("info")
    @SerializedName("info")
    INFO,

    @JsonProperty("warning")
    @SerializedName("warning")
    WARNING,

    @JsonProperty("error")
    @SerializedName("error")
    ERROR,

    @JsonProperty("success")
    @SerializedName("success")
    SUCCESS
}
