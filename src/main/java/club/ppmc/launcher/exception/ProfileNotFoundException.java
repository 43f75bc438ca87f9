/**
 * ProfileNotFoundException.java
 *
 * 启动请求引用了配置文件中不存在的档案。
 */
package club.ppmc.launcher.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class ProfileNotFoundException extends InvalidConfigException {

    private final String profileName;

    public ProfileNotFoundException(String profileName) {
        super("PROFILE_NOT_FOUND", List.of("配置档案 '" + profileName + "' 不存在"));
        this.profileName = profileName;
    }
}
