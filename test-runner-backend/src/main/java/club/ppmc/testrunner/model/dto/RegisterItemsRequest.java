/**
 * RegisterItemsRequest.java
 *
 * 发现服务推送测试项的请求体。
 */
package club.ppmc.testrunner.model.dto;

import club.ppmc.testrunner.model.TestItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record RegisterItemsRequest(@NotNull @Valid List<TestItem> items) {}
