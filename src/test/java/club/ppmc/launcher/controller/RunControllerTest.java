package club.ppmc.launcher.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.launcher.exception.AlreadyRunningException;
import club.ppmc.launcher.exception.InvalidConfigException;
import club.ppmc.launcher.exception.NotRunningException;
import club.ppmc.launcher.exception.ProfileNotFoundException;
import club.ppmc.launcher.exception.SpawnFailureException;
import club.ppmc.launcher.model.LogLevel;
import club.ppmc.launcher.model.LogRecord;
import club.ppmc.launcher.model.LogStream;
import club.ppmc.launcher.model.RunState;
import club.ppmc.launcher.model.RunStatus;
import club.ppmc.launcher.service.RunSupervisorService;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * RunController 的 Web 层切片测试，监管服务由 mock 替代。
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean RunSupervisorService supervisorService;

    // ------------------------------------------------------------------
    // POST /api/run/start
    // ------------------------------------------------------------------

    @Test
    void start_returnsRunIdAndStatus() throws Exception {
        when(supervisorService.start("default")).thenReturn("run-1");
        when(supervisorService.status()).thenReturn(running());

        mockMvc.perform(post("/api/run/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"configRef":"default"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"))
                .andExpect(jsonPath("$.status.state").value("RUNNING"))
                .andExpect(jsonPath("$.status.pid").value(4242));
    }

    @Test
    void start_alreadyRunning_returns409() throws Exception {
        when(supervisorService.start("default")).thenThrow(new AlreadyRunningException(RunState.RUNNING));

        mockMvc.perform(post("/api/run/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"configRef\":\"default\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("ALREADY_RUNNING"));
    }

    @Test
    void start_unknownProfile_returns404() throws Exception {
        when(supervisorService.start("nope")).thenThrow(new ProfileNotFoundException("nope"));

        mockMvc.perform(post("/api/run/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"configRef\":\"nope\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("PROFILE_NOT_FOUND"));
    }

    @Test
    void start_invalidConfig_returns400WithViolations() throws Exception {
        when(supervisorService.start("default"))
                .thenThrow(new InvalidConfigException(List.of("必需的文件不存在: accounts.json")));

        mockMvc.perform(post("/api/run/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"configRef\":\"default\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("INVALID_CONFIG"))
                .andExpect(jsonPath("$.violations[0]").value("必需的文件不存在: accounts.json"));
    }

    @Test
    void start_spawnFailure_returns500() throws Exception {
        when(supervisorService.start("default")).thenThrow(
                new SpawnFailureException(List.of("python3"), new IOException("No such file or directory")));

        mockMvc.perform(post("/api/run/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"configRef\":\"default\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("SPAWN_FAILURE"));
    }

    @Test
    void start_malformedConfigRef_isRejectedBeforeSupervisor() throws Exception {
        mockMvc.perform(post("/api/run/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"configRef\":\"../etc\"}"))
                .andExpect(status().isBadRequest());

        verify(supervisorService, never()).start(anyString());
    }

    // ------------------------------------------------------------------
    // POST /api/run/stop
    // ------------------------------------------------------------------

    @Test
    void stop_withoutBody_returnsAck() throws Exception {
        when(supervisorService.stop(null)).thenReturn(running());

        mockMvc.perform(post("/api/run/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value("run-1"));
    }

    @Test
    void stop_withReason_passesReason() throws Exception {
        when(supervisorService.stop(any())).thenReturn(running());

        mockMvc.perform(post("/api/run/stop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"维护\"}"))
                .andExpect(status().isOk());

        verify(supervisorService).stop("维护");
    }

    @Test
    void stop_notRunning_returns409() throws Exception {
        when(supervisorService.stop(null)).thenThrow(new NotRunningException(RunState.IDLE));

        mockMvc.perform(post("/api/run/stop"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("NOT_RUNNING"));
    }

    // ------------------------------------------------------------------
    // GET
    // ------------------------------------------------------------------

    @Test
    void status_returnsSnapshot() throws Exception {
        when(supervisorService.status()).thenReturn(RunStatus.idle());

        mockMvc.perform(get("/api/run/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("IDLE"));
    }

    @Test
    void logs_returnsRecentRecords() throws Exception {
        when(supervisorService.recentLogs()).thenReturn(List.of(
                new LogRecord("run-1", 1, Instant.now(), LogLevel.ERROR, LogStream.STDERR, "ERROR: x")));

        mockMvc.perform(get("/api/run/logs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sequence").value(1))
                .andExpect(jsonPath("$[0].level").value("error"))
                .andExpect(jsonPath("$[0].text").value("ERROR: x"));
    }

    private static RunStatus running() {
        return new RunStatus(RunState.RUNNING, "run-1", "default", 4242L, Instant.now(), null, 5L, null, null);
    }
}
