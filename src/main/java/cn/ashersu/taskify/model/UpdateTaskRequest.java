package cn.ashersu.taskify.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 所有字段均可省略，省略的字段保持原值。
 */
public record UpdateTaskRequest(String title,
                                String description,
                                @JsonProperty("isCompleted") Boolean isCompleted) {
}
