package com.example.milestoneservice.controller;

import com.example.common.events.MilestoneUpdatedEvent;
import com.example.milestoneservice.entity.Milestone;
import com.example.milestoneservice.entity.Timeline;
import com.example.milestoneservice.repository.MilestoneRepository;
import com.example.milestoneservice.repository.TimelineRepository;
import com.example.milestoneservice.service.CascadeScheduler;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end update path against an in-memory database:
 * HTTP -> security -> transaction -> reorder/cascade -> after-commit Kafka send.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class MilestoneUpdateIntegrationTest {

    private static final String SECRET = "test-secret-key-for-milestone-service-tests-0123456789";
    private static final LocalDate ANCHOR = LocalDate.of(2024, 1, 1);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TimelineRepository timelineRepository;

    @Autowired
    private MilestoneRepository milestoneRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private KafkaTemplate<String, MilestoneUpdatedEvent> kafkaTemplate;

    @SpyBean
    private CascadeScheduler cascadeScheduler;

    private Long timelineId;

    /**
     * Ids of the seeded milestones, index i holds order i + 1.
     */
    private List<Long> ids;

    @BeforeEach
    void setUp() {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(CompletableFuture.completedFuture(null));

        Timeline timeline = timelineRepository.save(Timeline.builder()
                .name("Delivery")
                .reference("project")
                .referenceId(1L)
                .startDate(ANCHOR)
                .build());
        timelineId = timeline.getId();

        // Six contiguous milestones of 5 days each: 01-01..01-05, 01-06..01-10, ...
        ids = new ArrayList<>();
        LocalDate start = ANCHOR;
        for (int order = 1; order <= 6; order++) {
            Milestone saved = milestoneRepository.save(Milestone.builder()
                    .timelineId(timelineId)
                    .sortOrder(order)
                    .duration(5)
                    .startDate(start)
                    .endDate(Milestone.endDateFor(start, 5))
                    .name("Milestone " + order)
                    .status("draft")
                    .type("generic")
                    .build());
            ids.add(saved.getId());
            start = saved.getEndDate().plusDays(1);
        }
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.update("DELETE FROM milestones");
        jdbcTemplate.update("DELETE FROM timelines");
    }

    private String token(long userId, String... roles) {
        return "Bearer " + Jwts.builder()
                .subject(String.valueOf(userId))
                .claim("roles", List.of(roles))
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }

    private ResultActions patchMilestone(Long milestoneId, Map<String, Object> param) throws Exception {
        return mockMvc.perform(patch("/api/timelines/{timelineId}/milestones/{milestoneId}", timelineId, milestoneId)
                .header("Authorization", token(42, "MANAGER"))
                .header("X-Request-ID", "req-123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(Map.of("param", param))));
    }

    private List<Milestone> ordered() {
        return milestoneRepository.findAllByTimelineIdOrdered(timelineId);
    }

    private void assertTimelineInvariants() {
        List<Milestone> milestones = ordered();
        for (int i = 0; i < milestones.size(); i++) {
            Milestone current = milestones.get(i);
            assertThat(current.getSortOrder()).as("dense order").isEqualTo(i + 1);
            assertThat(current.getEndDate())
                    .isEqualTo(Milestone.endDateFor(current.getStartDate(), current.getDuration()));
            if (i > 0) {
                assertThat(current.getStartDate())
                        .as("start of order %d", current.getSortOrder())
                        .isEqualTo(milestones.get(i - 1).effectiveEndDate().plusDays(1));
            }
        }
    }

    @SuppressWarnings("unchecked")
    private ProducerRecord<String, MilestoneUpdatedEvent> singlePublishedRecord() {
        ArgumentCaptor<ProducerRecord> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate, times(1)).send(captor.capture());
        return (ProducerRecord<String, MilestoneUpdatedEvent>) captor.getValue();
    }

    @Test
    void movingFiveToTwoShiftsTheDisplacedSiblings() throws Exception {
        patchMilestone(ids.get(4), Map.of("order", 2))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.order").value(2))
                .andExpect(jsonPath("$.data.deletedAt").doesNotExist());

        assertThat(ordered()).extracting(Milestone::getId).containsExactly(
                ids.get(0), ids.get(4), ids.get(1), ids.get(2), ids.get(3), ids.get(5));
    }

    @Test
    void longerDurationReschedulesEveryLaterMilestone() throws Exception {
        patchMilestone(ids.get(1), Map.of("duration", 10))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.startDate").value("2024-01-06"))
                .andExpect(jsonPath("$.data.endDate").value("2024-01-15"));

        Milestone third = milestoneRepository.findById(ids.get(2)).orElseThrow();
        assertThat(third.getStartDate()).isEqualTo(LocalDate.of(2024, 1, 16));
        assertThat(third.getEndDate()).isEqualTo(LocalDate.of(2024, 1, 20));
        assertTimelineInvariants();
    }

    @Test
    void earlyCompletionPullsLaterMilestonesForward() throws Exception {
        patchMilestone(ids.get(0), Map.of("completionDate", "2024-01-03"))
                .andExpect(status().isOk());

        assertThat(milestoneRepository.findById(ids.get(1)).orElseThrow().getStartDate())
                .isEqualTo(LocalDate.of(2024, 1, 4));
        assertTimelineInvariants();
    }

    @Test
    void completionBeforeStartIsRejectedAndNothingChanges() throws Exception {
        patchMilestone(ids.get(1), Map.of("completionDate", "2024-01-01", "order", 4))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("COMPLETION_BEFORE_START"));

        assertThat(ordered()).extracting(Milestone::getId).containsExactlyElementsOf(ids);
        assertThat(milestoneRepository.findById(ids.get(1)).orElseThrow().getCompletionDate()).isNull();
        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
    }

    @Test
    void oneEventCarriesOriginalAndUpdatedTargetOnly() throws Exception {
        patchMilestone(ids.get(2), Map.of("duration", 7, "order", 1))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-ID", "req-123"));

        ProducerRecord<String, MilestoneUpdatedEvent> record = singlePublishedRecord();
        assertThat(record.topic()).isEqualTo("milestone.updated");
        assertThat(record.key()).isEqualTo(ids.get(2).toString());
        assertThat(record.value().getCorrelationId()).isEqualTo("req-123");
        assertThat(record.value().getOriginal().getSortOrder()).isEqualTo(3);
        assertThat(record.value().getOriginal().getDuration()).isEqualTo(5);
        assertThat(record.value().getUpdated().getSortOrder()).isEqualTo(1);
        assertThat(record.value().getUpdated().getDuration()).isEqualTo(7);
        assertThat(record.value().getUpdated().getUpdatedBy()).isEqualTo(42L);
    }

    @Test
    void failureDuringCascadeRollsBackReorderAndFieldChanges() throws Exception {
        doThrow(new IllegalStateException("store unavailable")).when(cascadeScheduler).cascade(any());

        patchMilestone(ids.get(4), Map.of("order", 2, "duration", 9, "name", "Changed"))
                .andExpect(status().isInternalServerError());

        assertThat(ordered()).extracting(Milestone::getId).containsExactlyElementsOf(ids);
        Milestone target = milestoneRepository.findById(ids.get(4)).orElseThrow();
        assertThat(target.getDuration()).isEqualTo(5);
        assertThat(target.getName()).isEqualTo("Milestone 5");
        verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
    }

    @Test
    void publishFailureDoesNotRollBackTheUpdate() throws Exception {
        when(kafkaTemplate.send(any(ProducerRecord.class))).thenThrow(new IllegalStateException("broker down"));

        patchMilestone(ids.get(0), Map.of("duration", 6))
                .andExpect(status().isOk());

        assertThat(milestoneRepository.findById(ids.get(0)).orElseThrow().getDuration()).isEqualTo(6);
        assertTimelineInvariants();
    }

    @Test
    void softDeletedMilestonesAreIgnored() throws Exception {
        jdbcTemplate.update("UPDATE milestones SET deleted_at = ?, deleted_by = 1 WHERE id = ?",
                Timestamp.from(Instant.now()), ids.get(5));

        patchMilestone(ids.get(0), Map.of("duration", 8)).andExpect(status().isOk());

        LocalDate deletedStart = jdbcTemplate.queryForObject(
                "SELECT start_date FROM milestones WHERE id = ?", LocalDate.class, ids.get(5));
        assertThat(deletedStart).isEqualTo(LocalDate.of(2024, 1, 26));
        assertThat(ordered()).hasSize(5);
        assertTimelineInvariants();
    }

    @Test
    void clearingCompletionDateWithNullReschedules() throws Exception {
        patchMilestone(ids.get(0), Map.of("completionDate", "2024-01-03")).andExpect(status().isOk());

        Map<String, Object> clear = new HashMap<>();
        clear.put("completionDate", null);
        patchMilestone(ids.get(0), clear)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.completionDate").doesNotExist());

        assertThat(milestoneRepository.findById(ids.get(1)).orElseThrow().getStartDate())
                .isEqualTo(LocalDate.of(2024, 1, 6));
        assertTimelineInvariants();
    }

    @Test
    void derivedDatesCannotBeSet() throws Exception {
        patchMilestone(ids.get(0), Map.of("startDate", "2024-02-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownMilestoneIsNotFound() throws Exception {
        patchMilestone(999_999L, Map.of("name", "x"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("MILESTONE_NOT_FOUND"));
    }

    @Test
    void missingTokenIsUnauthorized() throws Exception {
        mockMvc.perform(patch("/api/timelines/{timelineId}/milestones/{milestoneId}", timelineId, ids.get(0))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"param\":{\"name\":\"x\"}}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void roleWithoutEditPermissionIsForbidden() throws Exception {
        mockMvc.perform(patch("/api/timelines/{timelineId}/milestones/{milestoneId}", timelineId, ids.get(0))
                        .header("Authorization", token(7, "CUSTOMER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"param\":{\"name\":\"x\"}}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        assertThat(milestoneRepository.findById(ids.get(0)).orElseThrow().getName()).isEqualTo("Milestone 1");
    }

    @Test
    void listingReflectsTheNewOrderAfterAMove() throws Exception {
        patchMilestone(ids.get(4), Map.of("order", 2)).andExpect(status().isOk());

        mockMvc.perform(get("/api/timelines/{timelineId}/milestones", timelineId)
                        .header("Authorization", token(7, "CUSTOMER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(6))
                .andExpect(jsonPath("$.data[1].id").value(ids.get(4)))
                .andExpect(jsonPath("$.data[1].order").value(2))
                .andExpect(jsonPath("$.data[2].id").value(ids.get(1)))
                .andExpect(jsonPath("$.data[2].order").value(3));
    }

    @Test
    void singleMilestoneIsReadableAndUnknownTimelineIsNotFound() throws Exception {
        mockMvc.perform(get("/api/timelines/{timelineId}/milestones/{milestoneId}", timelineId, ids.get(0))
                        .header("Authorization", token(7, "CUSTOMER")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("Milestone 1"))
                .andExpect(jsonPath("$.data.endDate").value("2024-01-05"));

        mockMvc.perform(get("/api/timelines/{timelineId}/milestones/{milestoneId}", 999_999L, ids.get(0))
                        .header("Authorization", token(7, "CUSTOMER")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("TIMELINE_NOT_FOUND"));
    }
}
