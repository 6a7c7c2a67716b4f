package com.opensciencecatalog.backend.item.controller;

import static org.hamcrest.Matchers.equalTo;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.opensciencecatalog.backend.item.service.ItemSubmissionService;
import com.opensciencecatalog.backend.submission.ChangeDescriptor;
import com.opensciencecatalog.backend.submission.ChangeKind;
import com.opensciencecatalog.backend.submission.ContentConflictException;
import com.opensciencecatalog.backend.submission.InvalidSubmissionException;
import com.opensciencecatalog.backend.submission.SubmissionReceipt;
import com.opensciencecatalog.backend.submission.SubmissionStatus;
import com.opensciencecatalog.backend.submission.TransientPlatformException;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ItemController.class)
class ItemControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private ItemSubmissionService itemSubmissionService;

  @BeforeEach
  void setUp() {
    given(itemSubmissionService.resolveUser(isNull())).willReturn("my-user");
    given(itemSubmissionService.resolveUser("bob")).willReturn("bob");
  }

  @Test
  void createItemAnswersWithPullRequest() throws Exception {
    given(itemSubmissionService.createItem(eq("bob"), eq("x.json"), eq("product"), any()))
        .willReturn(new SubmissionReceipt("add-bob-x-json", 12, "https://github.com/acme/catalog/pull/12"));

    mockMvc
        .perform(
            post("/api/items")
                .header(ItemController.USER_HEADER, "bob")
                .param("filename", "x.json")
                .param("itemType", "product")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"x\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.branch", equalTo("add-bob-x-json")))
        .andExpect(jsonPath("$.pullRequestNumber", equalTo(12)))
        .andExpect(jsonPath("$.pullRequestUrl", equalTo("https://github.com/acme/catalog/pull/12")));
  }

  @Test
  void createItemWithoutBodySubmitsEmptyContent() throws Exception {
    given(itemSubmissionService.createItem(eq("my-user"), eq("x.json"), eq("product"), isNull()))
        .willReturn(new SubmissionReceipt("add-my-user-x-json", 13, "https://github.com/acme/catalog/pull/13"));

    mockMvc
        .perform(post("/api/items").param("filename", "x.json").param("itemType", "product"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.pullRequestNumber", equalTo(13)));
    verify(itemSubmissionService).createItem(eq("my-user"), eq("x.json"), eq("product"), isNull());
  }

  @Test
  void missingFilenameIsBadRequest() throws Exception {
    mockMvc
        .perform(post("/api/items").param("itemType", "product").content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title", equalTo("Invalid request")));
  }

  @Test
  void updateConflictMapsToConflict() throws Exception {
    given(itemSubmissionService.updateItem(eq("my-user"), eq("x.json"), eq("product"), any()))
        .willThrow(new ContentConflictException("my-user/x.json", "Content of my-user/x.json changed"));

    mockMvc
        .perform(
            put("/api/items/x.json")
                .param("itemType", "product")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.path", equalTo("my-user/x.json")));
  }

  @Test
  void deleteInvalidSubmissionMapsToBadRequest() throws Exception {
    given(itemSubmissionService.deleteItem("bob", "x.json", " "))
        .willThrow(new InvalidSubmissionException("itemType must not be blank"));

    mockMvc
        .perform(delete("/api/items/x.json").header(ItemController.USER_HEADER, "bob").param("itemType", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail", equalTo("itemType must not be blank")));
  }

  @Test
  void platformFailureMapsToBadGateway() throws Exception {
    given(itemSubmissionService.deleteItem("bob", "x.json", "product"))
        .willThrow(
            new TransientPlatformException(
                "create_branch", "delete-bob-x-json", "GitHub call failed", new IOException("reset")));

    mockMvc
        .perform(delete("/api/items/x.json").header(ItemController.USER_HEADER, "bob").param("itemType", "product"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.operation", equalTo("create_branch")));
  }

  @Test
  void listsPendingItems() throws Exception {
    given(itemSubmissionService.pendingItems("bob")).willReturn(List.of("bob/x.json"));

    mockMvc
        .perform(get("/api/items").header(ItemController.USER_HEADER, "bob").param("filter", "pending"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0]", equalTo("bob/x.json")));
  }

  @Test
  void listsConfirmedItemsByDefault() throws Exception {
    given(itemSubmissionService.confirmedItems("my-user")).willReturn(List.of("my-user/a.json"));

    mockMvc
        .perform(get("/api/items"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0]", equalTo("my-user/a.json")));
    verify(itemSubmissionService).confirmedItems("my-user");
  }

  @Test
  void listsSubmissionsWithDisplayStatus() throws Exception {
    ChangeDescriptor descriptor =
        ChangeDescriptor.proposed("bob/x.json", "product", ChangeKind.ADD, "bob", false)
            .withPullRequest(
                SubmissionStatus.PENDING,
                "https://github.com/acme/catalog/pull/12",
                Instant.parse("2024-05-01T10:00:00Z"));
    given(itemSubmissionService.submissions("bob", null)).willReturn(List.of(descriptor));

    mockMvc
        .perform(get("/api/submissions").header(ItemController.USER_HEADER, "bob"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].filename", equalTo("bob/x.json")))
        .andExpect(jsonPath("$[0].changeType", equalTo("Add")))
        .andExpect(jsonPath("$[0].status", equalTo("Pending")));
  }
}
