package com.sqlstage.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDescriptor {
    private String name;
    private String type;

    public static FieldDescriptor named(String name) {
        return new FieldDescriptor(name, null);
    }
}
