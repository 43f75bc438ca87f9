package club.ppmc.launcher.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.launcher.model.ScriptProfile;
import club.ppmc.launcher.service.ProfileService;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ProfileController.class)
class ProfileControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean ProfileService profileService;

    @Test
    void getProfiles_returnsAllProfiles() throws Exception {
        when(profileService.getProfiles()).thenReturn(Map.of("default", profile("launcher.py")));

        mockMvc.perform(get("/api/profiles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.default.command[2]").value("launcher.py"));
    }

    @Test
    void getProfile_unknown_returns404() throws Exception {
        when(profileService.findProfile("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/profiles/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("PROFILE_NOT_FOUND"));
    }

    @Test
    void getProfile_unreadableStore_returns500() throws Exception {
        when(profileService.findProfile("default")).thenThrow(new IOException("disk error"));

        mockMvc.perform(get("/api/profiles/default"))
                .andExpect(status().isInternalServerError());
    }

    private static ScriptProfile profile(String script) {
        var profile = new ScriptProfile();
        profile.setCommand(List.of("python3", "-u", script));
        return profile;
    }
}
