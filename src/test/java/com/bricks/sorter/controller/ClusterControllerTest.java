package com.bricks.sorter.controller;

import com.bricks.sorter.config.SorterProperties;
import com.bricks.sorter.error.FormatUnrecognizedException;
import com.bricks.sorter.error.GlobalExceptionHandler;
import com.bricks.sorter.error.InvalidParameterException;
import com.bricks.sorter.input.InventoryFormatRegistry;
import com.bricks.sorter.model.ClusterSummary;
import com.bricks.sorter.model.ClusteringResult;
import com.bricks.sorter.model.EnrichedWorkingSet;
import com.bricks.sorter.service.InventorySortingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * {@link ClusterController} tested with standalone MockMvc and a mocked pipeline.
 */
@DisplayName("ClusterController")
class ClusterControllerTest {

    @TempDir
    Path workDir;

    private InventorySortingService sorting;

    private InventoryFormatRegistry registry;

    private MockMvc mockMvc;

    private final EnrichedWorkingSet parts = new EnrichedWorkingSet(List.of());

    @BeforeEach
    void setUp() {
        sorting = mock(InventorySortingService.class);
        registry = mock(InventoryFormatRegistry.class);
        SorterProperties props = new SorterProperties();
        props.setWorkDir(workDir.toString());
        props.setDefaultClusters(10);

        mockMvc = MockMvcBuilders.standaloneSetup(new ClusterController(sorting, registry, props))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("runs the pipeline on the uploaded file and removes it afterwards")
    void clusterUpload() throws Exception {
        // given
        AtomicReference<String> seenContent = new AtomicReference<>();
        when(sorting.loadAndEnrich(isNull(), any(Path.class))).thenAnswer(inv -> {
            Path p = inv.getArgument(1);
            seenContent.set(Files.readString(p, StandardCharsets.UTF_8));
            return parts;
        });
        List<ClusterSummary> bins = List.of(
                new ClusterSummary("Other", 2, List.of(99999)),
                new ClusterSummary("1. Basic, Bricks", 8, List.of(3001)));
        when(sorting.cluster(parts, 2, "5")).thenReturn(new ClusteringResult(bins, 5, 2));
        when(sorting.render(bins)).thenReturn("<div>bins</div>");

        MockMultipartFile file = new MockMultipartFile("partList", "inventory.csv", "text/csv",
                "Part,Color,Quantity\n3001,4,8\n".getBytes(StandardCharsets.UTF_8));

        // when / then
        mockMvc.perform(multipart("/api/clusters").file(file).param("clusters", "2").param("seed", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seed").value(5))
                .andExpect(jsonPath("$.clusters[0].label").value("Other"))
                .andExpect(jsonPath("$.clusters[1].quantity").value(8))
                .andExpect(jsonPath("$.clusters[1].members[0]").value(3001))
                .andExpect(jsonPath("$.html").value("<div>bins</div>"));

        assertThat(seenContent.get()).startsWith("Part,Color,Quantity");
        ArgumentCaptor<Path> upload = ArgumentCaptor.forClass(Path.class);
        verify(sorting).loadAndEnrich(isNull(), upload.capture());
        assertThat(upload.getValue()).doesNotExist();
    }

    @Test
    @DisplayName("uses the set number and the default cluster count")
    void clusterSetNumber() throws Exception {
        when(sorting.loadAndEnrich(eq("42115"), isNull())).thenReturn(parts);
        when(sorting.cluster(parts, 10, null)).thenReturn(new ClusteringResult(List.of(), 77, 10));
        when(sorting.render(List.of())).thenReturn("");

        mockMvc.perform(multipart("/api/clusters").param("setNumber", "42115"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seed").value(77));
    }

    @Test
    @DisplayName("answers 422 when no format matches")
    void unrecognized() throws Exception {
        when(sorting.loadAndEnrich(any(), any())).thenThrow(new FormatUnrecognizedException("Unrecognized inventory format"));

        mockMvc.perform(multipart("/api/clusters")
                        .file(new MockMultipartFile("partList", "x.txt", "text/plain", "hello".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("FORMAT_UNRECOGNIZED"))
                .andExpect(jsonPath("$.path").value("/api/clusters"));
    }

    @Test
    @DisplayName("answers 400 for a cluster count out of range")
    void invalidClusters() throws Exception {
        when(sorting.loadAndEnrich(any(), any())).thenReturn(parts);
        when(sorting.cluster(any(), anyInt(), any())).thenThrow(new InvalidParameterException("k out of range"));

        mockMvc.perform(multipart("/api/clusters").param("setNumber", "42115").param("clusters", "99"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));
    }

    @Test
    @DisplayName("answers 400 for a non-numeric cluster count")
    void nonNumericClusters() throws Exception {
        mockMvc.perform(multipart("/api/clusters").param("clusters", "many"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(sorting);
    }

    @Test
    @DisplayName("lists the supported formats")
    void formats() throws Exception {
        when(registry.supportedExtensions()).thenReturn(".json,.csv,.bsx,.pbg");
        when(registry.isSetLookupEnabled()).thenReturn(true);

        mockMvc.perform(get("/api/clusters/formats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.extensions").value(".json,.csv,.bsx,.pbg"))
                .andExpect(jsonPath("$.setLookupEnabled").value(true));
    }
}
