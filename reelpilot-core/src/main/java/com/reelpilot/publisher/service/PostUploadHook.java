package com.reelpilot.publisher.service;

import com.reelpilot.publisher.model.PendingUploadItem;

/**
 * Follow-up work run after a video is published and its state is committed.
 * A failing hook is logged by the worker and does not undo the upload.
 */
public interface PostUploadHook {

    void afterUpload(PendingUploadItem item, String externalVideoId) throws Exception;
}
