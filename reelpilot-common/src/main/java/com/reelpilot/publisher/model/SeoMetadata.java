package com.reelpilot.publisher.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SeoMetadata {
    private String title;
    private String description;
    private List<String> tags = new ArrayList<>();
}
