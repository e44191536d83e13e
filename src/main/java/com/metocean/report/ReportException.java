package com.metocean.report;

/**
 * 报表运行期的致命错误。
 * 携带错误类别，入口程序据此输出诊断信息并终止运行。
 */
public class ReportException extends RuntimeException {

    /**
     * 错误类别
     */
    public enum ErrorKind {
        /** 配置文件缺失、必选项缺失或取值无法解析 */
        CONFIGURATION,
        /** 输入文件列数、格式不符合约定 */
        SCHEMA,
        /** 计算前置条件不满足（如Hs非正、时间戳重复） */
        PRECONDITION,
        /** 表格计算过程中的意外失败 */
        COMPUTATION
    }

    private final ErrorKind kind;

    public ReportException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ReportException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    public static ReportException configuration(String message) {
        return new ReportException(ErrorKind.CONFIGURATION, message);
    }

    public static ReportException schema(String message) {
        return new ReportException(ErrorKind.SCHEMA, message);
    }

    public static ReportException precondition(String message) {
        return new ReportException(ErrorKind.PRECONDITION, message);
    }

    @Override
    public String toString() {
        return "ReportException{" + kind + ": " + getMessage() + "}";
    }
}
