package com.sqlstage.api;

import com.sqlstage.model.FieldDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse {
    private List<Map<String, Object>> results;
    private List<FieldDescriptor> fields;
    private PageMetadata metadata;
}
