/**
 * ServerMode.java
 *
 * 外部 Java 语言服务器报告的运行模式。
 * UNKNOWN 是初始值：较老的语言服务器不会报告模式，此时在能力判断上等同于 STANDARD。
 */
package club.ppmc.testrunner.model;

import java.util.Arrays;

public enum ServerMode {
    LIGHT_WEIGHT("LightWeight"),
    STANDARD("Standard"),
    HYBRID("Hybrid"),
    UNKNOWN("Unknown");

    private final String wireName;

    ServerMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 宽松地解析语言服务器发来的模式字符串。null、空串或无法识别的值都映射为 UNKNOWN。
     */
    public static ServerMode fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(mode -> mode.wireName.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
