package com.reelpilot.publisher.service;

import com.reelpilot.publisher.model.PendingUploadItem;
import com.reelpilot.publisher.util.VideoTypes;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Once a long video is live, points the still-pending shorts of the same topic at it.
 */
@Service
@Order(10)
@RequiredArgsConstructor
public class CrossPromotionLinker implements PostUploadHook {

    private final UploadQueueService uploadQueue;

    @Override
    public void afterUpload(PendingUploadItem item, String externalVideoId) {
        if (!VideoTypes.isLong(item.getType())) {
            return;
        }
        uploadQueue.linkShortsToLongVideo(item.getTopic(), externalVideoId);
    }
}
