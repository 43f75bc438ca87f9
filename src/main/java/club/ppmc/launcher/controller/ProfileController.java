/**
 * ProfileController.java
 *
 * 以只读方式展示外部配置文件中的运行档案。
 * 档案的编辑在文件中完成，修改会在下一次启动运行时生效。
 */
package club.ppmc.launcher.controller;

import club.ppmc.launcher.service.ProfileService;
import java.io.IOException;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/profiles")
@Slf4j
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @GetMapping
    public ResponseEntity<?> getProfiles() {
        try {
            return ResponseEntity.ok(profileService.getProfiles());
        } catch (IOException e) {
            log.error("读取运行档案失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "读取运行档案失败: " + e.getMessage()));
        }
    }

    @GetMapping("/{name}")
    public ResponseEntity<?> getProfile(@PathVariable String name) {
        try {
            return profileService.findProfile(name)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("type", "PROFILE_NOT_FOUND", "message", "运行档案不存在: " + name)));
        } catch (IOException e) {
            log.error("读取运行档案 {} 失败", name, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "读取运行档案失败: " + e.getMessage()));
        }
    }
}
