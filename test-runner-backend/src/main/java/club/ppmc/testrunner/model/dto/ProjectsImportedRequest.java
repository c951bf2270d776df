/**
 * ProjectsImportedRequest.java
 *
 * 语言服务器完成项目导入后上报的请求体。
 */
package club.ppmc.testrunner.model.dto;

import java.net.URI;
import java.util.List;

public record ProjectsImportedRequest(List<URI> projectUris) {}
