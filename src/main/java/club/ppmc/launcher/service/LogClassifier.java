/**
 * LogClassifier.java
 *
 * 根据行文本中的标记对日志进行分类。
 * 按 error -> warning -> success 的顺序依次匹配，第一个命中的级别即为结果，都未命中时为 info。
 * 每个级别的标记都是正则表达式，可在 application.properties 中覆盖；未配置时使用下方的默认标记。
 */
package club.ppmc.launcher.service;

import club.ppmc.launcher.model.LogLevel;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class LogClassifier {

    static final List<String> DEFAULT_ERROR_PATTERNS = List.of(
            "(?i)\\berror\\b", "(?i)\\bfatal\\b", "(?i)\\bexception\\b", "Traceback", "❌", "错误", "失败", "异常");

    static final List<String> DEFAULT_WARNING_PATTERNS = List.of(
            "(?i)\\bwarn(ing)?\\b", "⚠", "警告");

    static final List<String> DEFAULT_SUCCESS_PATTERNS = List.of(
            "(?i)\\bsuccess(ful(ly)?)?\\b", "✅", "🎉", "成功", "完成");

    private final List<Pattern> errorPatterns;
    private final List<Pattern> warningPatterns;
    private final List<Pattern> successPatterns;

    public LogClassifier(
            @Value("${app.log.error-patterns:}") List<String> errorPatterns,
            @Value("${app.log.warning-patterns:}") List<String> warningPatterns,
            @Value("${app.log.success-patterns:}") List<String> successPatterns) {
        this.errorPatterns = compile(errorPatterns, DEFAULT_ERROR_PATTERNS);
        this.warningPatterns = compile(warningPatterns, DEFAULT_WARNING_PATTERNS);
        this.successPatterns = compile(successPatterns, DEFAULT_SUCCESS_PATTERNS);
        log.info("日志分类标记已加载: error={}, warning={}, success={}",
                this.errorPatterns.size(), this.warningPatterns.size(), this.successPatterns.size());
    }

    /**
     * 使用默认标记创建分类器。
     */
    public static LogClassifier withDefaults() {
        return new LogClassifier(List.of(), List.of(), List.of());
    }

    public LogLevel classify(String text) {
        if (matchesAny(errorPatterns, text)) {
            return LogLevel.ERROR;
        }
        if (matchesAny(warningPatterns, text)) {
            return LogLevel.WARNING;
        }
        if (matchesAny(successPatterns, text)) {
            return LogLevel.SUCCESS;
        }
        return LogLevel.INFO;
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> configured, List<String> defaults) {
        List<String> source = configured == null || configured.stream().allMatch(String::isBlank)
                ? defaults
                : configured;
        return source.stream().filter(s -> !s.isBlank()).map(Pattern::compile).toList();
    }
}
