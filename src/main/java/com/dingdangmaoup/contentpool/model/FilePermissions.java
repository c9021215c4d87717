package com.dingdangmaoup.contentpool.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilePermissions {
    private boolean readOnly;
    private String unixMode;  // e.g. "755"
}
