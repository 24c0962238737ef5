package com.erpdashboard.backend.modules.branch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;

import com.erpdashboard.backend.global.error.ProblemException;
import com.erpdashboard.backend.modules.branch.application.BranchService;
import com.erpdashboard.backend.modules.branch.application.DefaultBranchSeeder;
import com.erpdashboard.backend.modules.branch.domain.DefaultBranches;
import com.erpdashboard.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.erpdashboard.backend.modules.sequence.application.SequenceAllocator;
import com.erpdashboard.backend.support.AbstractPostgresIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class BranchIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private BranchRepository branchRepository;

    @Autowired
    private BranchService branchService;

    @Autowired
    private DefaultBranchSeeder defaultBranchSeeder;

    @Autowired
    private SequenceAllocator sequenceAllocator;

    @Test
    void activeBranchesAreListedByNameWithoutAuthentication() throws Exception {
        String body = mockMvc.perform(get("/api/branches/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.branches[0].branchName").value("Barisal Branch"))
                .andReturn()
                .getResponse()
                .getContentAsString();

        JsonNode branches = objectMapper.readTree(body).path("branches");
        assertThat(branches).hasSize(DefaultBranches.ALL.size());

        List<String> names = new ArrayList<>();
        branches.forEach(node -> names.add(node.path("branchName").asText()));
        assertThat(names).isSorted();
        assertThat(branches).anySatisfy(node -> {
            assertThat(node.path("branchId").asText()).isEqualTo("main");
            assertThat(node.path("branchCode").asText()).isEqualTo("DH");
            assertThat(node.path("branchLocation").asText()).isEqualTo("Dhaka, Bangladesh");
        });
    }

    @Test
    void seedingIsIdempotentAndRestoresMissingCounters() {
        long branchCount = branchRepository.count();

        int inserted = defaultBranchSeeder.seedDefaultBranches();

        assertThat(inserted).isZero();
        assertThat(branchRepository.count()).isEqualTo(branchCount);
        for (DefaultBranches.BranchSeed seed : DefaultBranches.ALL) {
            assertThat(sequenceAllocator.currentValue(seed.branchCode()))
                    .as("counter for %s", seed.branchCode())
                    .contains(sequenceAllocator.getInitialValue());
        }
    }

    @Test
    void reseedingKeepsAllocatedValues() {
        sequenceAllocator.allocateNext("CTG");
        sequenceAllocator.allocateNext("CTG");

        defaultBranchSeeder.seedDefaultBranches();

        assertThat(sequenceAllocator.currentValue("CTG")).contains(2L);
    }

    @Test
    void inactiveBranchIsHiddenAndCannotBeJoined() throws Exception {
        jdbcTemplate.update("UPDATE branch SET status = 'INACTIVE' WHERE branch_id = ?", "mymensingh");
        try {
            mockMvc.perform(get("/api/branches/active"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.branches.length()").value(DefaultBranches.ALL.size() - 1));

            assertThatThrownBy(() -> branchService.requireActiveBranch("mymensingh"))
                    .isInstanceOf(ProblemException.class)
                    .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("BRANCH_NOT_FOUND"));
        } finally {
            jdbcTemplate.update("UPDATE branch SET status = 'ACTIVE' WHERE branch_id = ?", "mymensingh");
        }
    }

    @Test
    void seedingSkipsADefaultWhoseCodeIsTakenByARenamedBranch() {
        jdbcTemplate.update("UPDATE branch SET branch_id = ? WHERE branch_id = ?", "mymensingh-hq", "mymensingh");
        try {
            assertThat(defaultBranchSeeder.seedDefaultBranches()).isZero();
            assertThat(branchRepository.existsByBranchId("mymensingh")).isFalse();
            assertThat(branchRepository.count()).isEqualTo(DefaultBranches.ALL.size());
        } finally {
            jdbcTemplate.update("UPDATE branch SET branch_id = ? WHERE branch_id = ?", "mymensingh", "mymensingh-hq");
        }
    }
}
