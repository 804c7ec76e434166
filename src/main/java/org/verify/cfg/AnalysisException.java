package org.verify.cfg;

/**
 * 输入文件无法读取、无法解析，或者找不到要分析的方法
 */
public class AnalysisException extends Exception {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
