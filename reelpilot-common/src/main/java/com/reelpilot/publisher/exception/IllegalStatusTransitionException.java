package com.reelpilot.publisher.exception;

import com.reelpilot.publisher.model.VideoStatus;

public class IllegalStatusTransitionException extends IllegalStateException {

    private final String videoId;
    private final VideoStatus from;
    private final VideoStatus to;

    public IllegalStatusTransitionException(String videoId, VideoStatus from, VideoStatus to) {
        super("Illegal status transition for " + videoId + ": " + from.wireName() + " -> " + to.wireName());
        this.videoId = videoId;
        this.from = from;
        this.to = to;
    }

    public String getVideoId() {
        return videoId;
    }

    public VideoStatus getFrom() {
        return from;
    }

    public VideoStatus getTo() {
        return to;
    }
}
