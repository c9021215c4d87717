package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Attribution and update-source metadata for published content
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublisherInfo {
    private String name;
    private String publisherType;
    private String website;
    private String updateApiEndpoint;
    private String contactEmail;
}
