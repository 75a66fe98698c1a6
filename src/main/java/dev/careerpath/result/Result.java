package dev.careerpath.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * JSON-serialisable envelope returned by every boundary operation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Result<T> {

    /** 0 on success, otherwise an {@link ErrorCode} value. */
    private Integer code;

    private String msg;

    private T data;

    /** Valid keys the caller may retry with, set on not-found errors. */
    private List<String> availableKeys;

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == ErrorCode.SUCCESS.getCode();
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(ErrorCode.SUCCESS.getCode(), ErrorCode.SUCCESS.getMsg(), data, null);
    }

    public static <T> Result<T> error(ErrorCode errorCode) {
        return error(errorCode, errorCode.getMsg());
    }

    public static <T> Result<T> error(ErrorCode errorCode, String msg) {
        return new Result<>(errorCode.getCode(), msg, null, null);
    }

    public static <T> Result<T> notFound(String msg, List<String> availableKeys) {
        return new Result<>(ErrorCode.NOT_FOUND.getCode(), msg, null, availableKeys);
    }
}
