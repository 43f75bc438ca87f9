/**
 * RunController.java
 *
 * 该控制器处理对受监管脚本的启动、停止和状态查询请求。
 * 业务错误由 RunSupervisorService 以 RunControlException 的形式抛出，
 * 这里按端点转换为对应的HTTP状态码，响应体为异常的结构化数据。
 */
package club.ppmc.launcher.controller;

import club.ppmc.launcher.exception.AlreadyRunningException;
import club.ppmc.launcher.exception.InvalidConfigException;
import club.ppmc.launcher.exception.NotRunningException;
import club.ppmc.launcher.exception.ProfileNotFoundException;
import club.ppmc.launcher.exception.SpawnFailureException;
import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.RunStatus;
import club.ppmc.launcher.model.StartRunRequest;
import club.ppmc.launcher.model.StopRunRequest;
import club.ppmc.launcher.service.RunSupervisorService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/run")
@Slf4j
public class RunController {

    private final RunSupervisorService supervisorService;

    public RunController(RunSupervisorService supervisorService) {
        this.supervisorService = supervisorService;
    }

    /**
     * 按配置档案启动脚本。
     */
    @PostMapping("/start")
    public ResponseEntity<?> start(@Valid @RequestBody StartRunRequest request) {
        try {
            String runId = supervisorService.start(request.configRef());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("runId", runId);
            body.put("status", supervisorService.status());
            return ResponseEntity.ok(body);
        } catch (AlreadyRunningException e) {
            log.warn("启动请求被拒绝: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.toErrorData());
        } catch (ProfileNotFoundException e) {
            log.warn("启动请求被拒绝: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.toErrorData());
        } catch (InvalidConfigException e) {
            log.warn("启动请求被拒绝: {}", e.getMessage());
            return ResponseEntity.badRequest().body(e.toErrorData());
        } catch (SpawnFailureException e) {
            log.error("启动脚本进程失败", e);
            return ResponseEntity.internalServerError().body(e.toErrorData());
        }
    }

    /**
     * 停止当前运行。先发送终止信号，宽限期后强制结束。
     * 请求体可以省略。
     */
    @PostMapping("/stop")
    public ResponseEntity<?> stop(@RequestBody(required = false) StopRunRequest request) {
        try {
            String reason = request != null ? request.reason() : null;
            return ResponseEntity.ok(supervisorService.stop(reason));
        } catch (NotRunningException e) {
            log.warn("停止请求被拒绝: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.toErrorData());
        }
    }

    @GetMapping("/status")
    public ResponseEntity<RunStatus> status() {
        return ResponseEntity.ok(supervisorService.status());
    }

    /**
     * 返回当前运行最近的日志，供不使用WebSocket的客户端轮询。
     */
    @GetMapping("/logs")
    public ResponseEntity<List<LogRecord>> logs() {
        return ResponseEntity.ok(supervisorService.recentLogs());
    }
}
