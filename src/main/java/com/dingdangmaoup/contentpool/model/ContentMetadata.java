package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentMetadata {
    private String description;
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    private String iconUrl;
    private LocalDate releaseDate;
}
