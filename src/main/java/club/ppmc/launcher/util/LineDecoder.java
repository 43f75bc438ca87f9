/**
 * LineDecoder.java
 *
 * 将子进程输出的一行原始字节解码为文本。
 * 脚本在不同平台上可能以 UTF-8 或 GBK 等编码输出，因此依次尝试配置的字符集进行严格解码，
 * 全部失败时退回到第一个字符集并用替换字符处理非法字节。
 */
package club.ppmc.launcher.util;

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class LineDecoder {

    private final List<Charset> charsets;

    public LineDecoder(@Value("${app.log.charsets:UTF-8,GBK}") List<String> charsetNames) {
        Preconditions.checkArgument(!charsetNames.isEmpty(), "至少需要配置一个字符集");
        this.charsets = charsetNames.stream().map(String::trim).map(Charset::forName).toList();
    }

    /**
     * 解码一行字节并去除首尾空白（包括行尾的 '\r'）。
     *
     * @param line 不包含换行符的一行原始字节。
     * @return 解码后的文本，可能为空字符串。
     */
    public String decode(byte[] line) {
        if (line.length == 0) {
            return "";
        }
        for (Charset charset : charsets) {
            String text = decodeStrictly(line, charset);
            if (text != null) {
                return text.strip();
            }
        }
        return new String(line, charsets.get(0)).strip();
    }

    private static String decodeStrictly(byte[] line, Charset charset) {
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(line))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
