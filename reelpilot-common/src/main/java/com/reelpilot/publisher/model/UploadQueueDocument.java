package com.reelpilot.publisher.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class UploadQueueDocument {
    private List<PendingUploadItem> pendingUploads = new ArrayList<>();
    private List<UploadedItem> uploaded = new ArrayList<>();
}
