/**
 * StopRunRequest.java
 *
 * 停止请求的请求体（可选），携带停止原因用于日志和状态展示。
 */
package club.ppmc.launcher.model;

public record StopRunRequest(String reason) {}
