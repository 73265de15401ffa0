package com.reelpilot.publisher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "app")
public class PublisherProperties {

    private State state = new State();
    private Quota quota = new Quota();
    private Upload upload = new Upload();
    private Lifecycle lifecycle = new Lifecycle();
    private Schedule schedule = new Schedule();
    private Uploader uploader = new Uploader();
    private Archive archive = new Archive();
    private Jobs jobs = new Jobs();

    @Data
    public static class State {
        private String dir = "channel";
    }

    @Data
    public static class Quota {
        private int dailyLimit = 10_000;
    }

    @Data
    public static class Upload {
        private int maxAttempts = 3;
        private int bufferHours = 1;
        private int windowMinutes = 5;
    }

    @Data
    public static class Lifecycle {
        private int maxAgeHours = 48;
        private boolean uploadedAtFallback = false;
    }

    @Data
    public static class Schedule {
        private String timezone = "Asia/Kolkata";
        private int bufferHours = 2;
        // weekday -> HH:mm, missing days use the built-in table
        private Map<DayOfWeek, String> shortSlots = new EnumMap<>(DayOfWeek.class);
        private Map<DayOfWeek, String> longSlots = new EnumMap<>(DayOfWeek.class);
        private int shortJitterMinutes = 10;
        private int longJitterMinutes = 8;
        private List<String> rotationSlots = new ArrayList<>(List.of("18:30", "12:30", "22:00", "19:00", "13:00"));
        private int rotationJitterMinutes = 5;
    }

    @Data
    public static class Uploader {
        private String type = "command";
        private List<String> command = new ArrayList<>();
        private int quotaExitCode = 75;
        private long timeoutSeconds = 1800;
    }

    @Data
    public static class Archive {
        private String dir = "archive";
    }

    @Data
    public static class Jobs {
        private int workerCount = 2;
        // JobRunr rejects intervals under 5 seconds
        private int pollIntervalSeconds = 15;
    }
}
