package com.chatintel.group.config;

import com.chatintel.group.config.GroupScraperProperties.Export.ExportFormat;
import com.chatintel.group.model.ChatSummary;
import com.chatintel.group.model.Group;
import com.chatintel.group.model.ScrapeRun;
import com.chatintel.group.model.StoredMessage;
import com.chatintel.group.output.ExportRouter;
import com.chatintel.group.output.ExportResult;
import com.chatintel.group.scheduler.ScrapeScheduler;
import com.chatintel.group.service.IngestionService;
import com.chatintel.group.service.MessageQueryService;
import com.chatintel.group.service.ScrapeTaskQueue;
import com.chatintel.group.source.ChatSource;
import com.chatintel.group.source.SourceConnectionMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class ScrapeController {

    private final ScrapeTaskQueue scrapeTaskQueue;
    private final IngestionService ingestionService;
    private final MessageQueryService messageQueryService;
    private final ScrapeScheduler scrapeScheduler;
    private final SourceConnectionMonitor connectionMonitor;
    private final ChatSource chatSource;
    private final ExportRouter exportRouter;
    private final GroupScraperProperties properties;

    // ── Status ────────────────────────────────────────────────────────────────

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("status", connectionMonitor.isReady() ? "ready" : "initializing");
        body.put("sourceState", connectionMonitor.getState());
        body.put("timestamp", Instant.now().toString());
        body.put("scrapeRunning", ingestionService.isScrapeRunning());
        body.put("cronJobs", scrapeScheduler.getStatus());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/cron/status")
    public ResponseEntity<Map<String, Object>> cronStatus() {
        return ResponseEntity.ok(Map.of("success", true, "status", scrapeScheduler.getStatus()));
    }

    // ── Scrape triggers ───────────────────────────────────────────────────────

    @PostMapping("/scrape/{groupId}")
    public ResponseEntity<Map<String, Object>> triggerGroup(@PathVariable String groupId) {
        if (!connectionMonitor.isReady()) {
            return sourceNotReady();
        }
        try {
            scrapeTaskQueue.submitGroup(groupId);
        } catch (RejectedExecutionException e) {
            return queueFull();
        }
        return ResponseEntity.accepted().body(Map.of(
                "success", true, "message", "Scrape started in background", "groupId", groupId));
    }

    @PostMapping("/scrape-all")
    public ResponseEntity<Map<String, Object>> triggerAll() {
        if (!connectionMonitor.isReady()) {
            return sourceNotReady();
        }
        try {
            scrapeTaskQueue.submitAll();
        } catch (RejectedExecutionException e) {
            return queueFull();
        }
        return ResponseEntity.accepted().body(Map.of(
                "success", true,
                "message", "Scrape started for all monitored groups",
                "groups", properties.getSource().getMonitoredGroups()));
    }

    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        try {
            int deleted = ingestionService.cleanupExpiredMessages();
            return ResponseEntity.ok(Map.of("success", true, "deleted", deleted));
        } catch (Exception e) {
            log.error("Manual cleanup failed: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to clean up messages", e);
        }
    }

    // ── Chat discovery ────────────────────────────────────────────────────────

    /**
     * Every chat the connected account can see, for finding group ids to monitor.
     *
     * GET /api/chats
     */
    @GetMapping("/chats")
    public ResponseEntity<Map<String, Object>> chats() {
        if (!connectionMonitor.isReady()) {
            return sourceNotReady();
        }
        try {
            List<ChatSummary> chats = chatSource.listChats();
            List<Map<String, Object>> rows = chats.stream().map(c -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("id", c.getId());
                row.put("name", c.getName());
                row.put("isGroup", c.isGroup());
                row.put("unreadCount", c.getUnreadCount());
                row.put("timestamp", c.getTimestamp());
                row.put("isMonitored", properties.getSource().getMonitoredGroups().contains(c.getId()));
                return row;
            }).toList();
            return ResponseEntity.ok(Map.of("success", true, "count", rows.size(), "chats", rows));
        } catch (Exception e) {
            log.error("Error fetching chats: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch chats", e);
        }
    }

    // ── Stored data ───────────────────────────────────────────────────────────

    @GetMapping("/groups")
    public ResponseEntity<Map<String, Object>> groups() {
        try {
            List<Group> groups = messageQueryService.listGroups();
            List<Map<String, Object>> rows = groups.stream().map(g -> {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("id", g.getId());
                row.put("name", g.getName());
                row.put("participantCount", g.getParticipantCount());
                row.put("createdAt", g.getCreatedAt());
                row.put("updatedAt", g.getUpdatedAt());
                row.put("isMonitored", properties.getSource().getMonitoredGroups().contains(g.getId()));
                return row;
            }).toList();
            return ResponseEntity.ok(Map.of("success", true, "count", rows.size(), "groups", rows));
        } catch (Exception e) {
            log.error("Error fetching groups: {}", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch groups", e);
        }
    }

    /**
     * Newest messages of a group.
     *
     * GET /api/groups/{groupId}/messages?limit=100&offset=0
     */
    @GetMapping("/groups/{groupId}/messages")
    public ResponseEntity<Map<String, Object>> messages(
            @PathVariable String groupId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.putAll(messageQueryService.getMessages(groupId, limit, offset));
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error fetching messages for {}: {}", groupId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch messages", e);
        }
    }

    /**
     * Messages between two ISO-8601 instants, both inclusive.
     *
     * GET /api/groups/{groupId}/messages/range?startDate=2024-05-01T00:00:00Z&endDate=2024-05-02T00:00:00Z
     */
    @GetMapping("/groups/{groupId}/messages/range")
    public ResponseEntity<Map<String, Object>> messagesInRange(
            @PathVariable String groupId,
            @RequestParam String startDate,
            @RequestParam String endDate) {
        try {
            List<StoredMessage> messages = messageQueryService.getMessagesBetween(
                    groupId, Instant.parse(startDate), Instant.parse(endDate));
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "groupId", groupId,
                    "dateRange", Map.of("startDate", startDate, "endDate", endDate),
                    "count", messages.size(),
                    "messages", messages));
        } catch (DateTimeParseException e) {
            return badRequest("startDate and endDate must be ISO-8601 instants, e.g. 2024-05-01T00:00:00Z");
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error fetching messages by date range for {}: {}", groupId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch messages by date range", e);
        }
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam(required = false) String groupId,
            @RequestParam(required = false) String q) {
        if (groupId == null || q == null || q.isBlank()) {
            return badRequest("groupId and q (search term) are required");
        }
        try {
            List<StoredMessage> messages = messageQueryService.search(groupId, q);
            return ResponseEntity.ok(Map.of(
                    "success", true, "groupId", groupId, "searchTerm", q,
                    "count", messages.size(), "messages", messages));
        } catch (Exception e) {
            log.error("Error searching messages in {}: {}", groupId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to search messages", e);
        }
    }

    @GetMapping("/groups/{groupId}/stats")
    public ResponseEntity<Map<String, Object>> stats(@PathVariable String groupId) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.putAll(messageQueryService.getStatistics(groupId));
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Error fetching statistics for {}: {}", groupId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch group statistics", e);
        }
    }

    @GetMapping("/groups/{groupId}/scrape-history")
    public ResponseEntity<Map<String, Object>> scrapeHistory(
            @PathVariable String groupId,
            @RequestParam(defaultValue = "10") int limit) {
        try {
            List<ScrapeRun> history = messageQueryService.getScrapeHistory(groupId, limit);
            return ResponseEntity.ok(Map.of(
                    "success", true, "groupId", groupId, "count", history.size(), "history", history));
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error fetching scrape history for {}: {}", groupId, e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to fetch scrape history", e);
        }
    }

    // ── Export ────────────────────────────────────────────────────────────────

    @PostMapping("/export/{groupId}")
    public ResponseEntity<?> exportGroup(
            @PathVariable String groupId,
            @RequestParam(required = false) String format,
            @RequestBody(required = false) Map<String, String> body) {
        return export(groupId, format, body);
    }

    @PostMapping("/export-all")
    public ResponseEntity<?> exportAll(
            @RequestParam(required = false) String format,
            @RequestBody(required = false) Map<String, String> body) {
        return export(null, format, body);
    }

    private ResponseEntity<?> export(String groupId, String format, Map<String, String> body) {
        ExportFormat exportFormat;
        try {
            exportFormat = format == null ? null : ExportFormat.valueOf(format.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return badRequest("format must be json or csv");
        }
        String outputFile = body != null ? body.get("outputFile") : null;
        try {
            ExportResult result = exportRouter.export(groupId, exportFormat, outputFile);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected export request: {}", e.getMessage());
            return badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Error exporting messages{}: {}", groupId != null ? " of " + groupId : "", e.getMessage(), e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to export messages", e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private ResponseEntity<Map<String, Object>> sourceNotReady() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "success", false,
                "error", "Chat source is not ready yet (state " + connectionMonitor.getState() + ")"));
    }

    private ResponseEntity<Map<String, Object>> queueFull() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "success", false, "error", "Too many scrapes queued, try again later"));
    }

    private ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("success", false, "error", message));
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, Exception e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        body.put("message", String.valueOf(e.getMessage()));
        return ResponseEntity.status(status).body(body);
    }
}
