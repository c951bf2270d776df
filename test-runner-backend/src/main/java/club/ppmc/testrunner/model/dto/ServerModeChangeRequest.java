/**
 * ServerModeChangeRequest.java
 *
 * 语言服务器宿主上报模式切换时的请求体。
 */
package club.ppmc.testrunner.model.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param mode 模式字符串，例如 "LightWeight"、"Standard"、"Hybrid"。
 */
public record ServerModeChangeRequest(@NotBlank String mode) {}
