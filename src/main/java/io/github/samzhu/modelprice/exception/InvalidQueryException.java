package io.github.samzhu.modelprice.exception;

/**
 * 查詢參數無效，例如未知的排序欄位、排序方向、能力或提供者。
 */
public class InvalidQueryException extends RuntimeException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
