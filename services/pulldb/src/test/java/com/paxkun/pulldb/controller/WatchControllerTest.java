package com.paxkun.pulldb.controller;

import com.paxkun.pulldb.model.CollectionRef;
import com.paxkun.pulldb.model.UserIdentity;
import com.paxkun.pulldb.service.LoggerService;
import com.paxkun.pulldb.service.pull.BatchResult;
import com.paxkun.pulldb.service.pull.ClassificationBucket;
import com.paxkun.pulldb.service.pull.PullListOptions;
import com.paxkun.pulldb.service.pull.PullListType;
import com.paxkun.pulldb.service.pull.PullQueryService;
import com.paxkun.pulldb.service.watch.WatchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WatchControllerTest {

    private static final UserIdentity ALICE = UserIdentity.of("alice");

    @Mock
    private WatchService watchService;

    @Mock
    private PullQueryService pullQueryService;

    @Mock
    private LoggerService loggerService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WatchController(watchService, pullQueryService))
                .setCustomArgumentResolvers(new UserIdentityArgumentResolver())
                .setControllerAdvice(new ApiExceptionHandler(loggerService))
                .build();
    }

    @Test
    void addParsesTheStartDate() throws Exception {
        when(watchService.addWatches(ALICE, List.of(10), List.of(), LocalDate.parse("2020-01-01")))
                .thenReturn(BatchResult.forAdds().record(ClassificationBucket.ADDED, "volume:10"));

        mockMvc.perform(post("/v1/watches/add")
                        .header("X-Pulldb-User", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volumes\": [10], \"arcs\": [], \"start\": \"2020-01-01\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results.added[0]").value("volume:10"));
    }

    @Test
    void unparseableStartDateIsABadRequest() throws Exception {
        mockMvc.perform(post("/v1/watches/add")
                        .header("X-Pulldb-User", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volumes\": [10], \"start\": \"whenever\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(watchService);
    }

    @Test
    void pullsOfAnUnwatchedCollectionAreNotFound() throws Exception {
        when(pullQueryService.listWatchPulls(eq(ALICE), eq(CollectionRef.arc(7)), eq(PullListType.NEW),
                eq(PullListOptions.DEFAULT), any()))
                .thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/watches/arc:7/pulls/new").header("X-Pulldb-User", "alice"))
                .andExpect(status().isNotFound());
    }

    @Test
    void malformedCollectionIsABadRequest() throws Exception {
        mockMvc.perform(get("/v1/watches/shelf:7/pulls/new").header("X-Pulldb-User", "alice"))
                .andExpect(status().isBadRequest());
    }
}
