package com.opensciencecatalog.backend.item.controller;

import com.opensciencecatalog.backend.item.api.ItemFilter;
import com.opensciencecatalog.backend.item.api.ItemsResponse;
import com.opensciencecatalog.backend.item.api.SubmissionReceiptResponse;
import com.opensciencecatalog.backend.item.api.SubmissionResponse;
import com.opensciencecatalog.backend.item.service.ItemSubmissionService;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Catalog item submissions. Every write answers with the pull request opened for it. */
@RestController
@RequestMapping("/api")
public class ItemController {

  public static final String USER_HEADER = "X-Catalog-User";

  private final ItemSubmissionService itemSubmissionService;

  public ItemController(ItemSubmissionService itemSubmissionService) {
    this.itemSubmissionService = itemSubmissionService;
  }

  @PostMapping("/items")
  @ResponseStatus(HttpStatus.CREATED)
  public SubmissionReceiptResponse createItem(
      @RequestHeader(name = USER_HEADER, required = false) String user,
      @RequestParam("filename") String filename,
      @RequestParam("itemType") String itemType,
      @RequestBody(required = false) byte[] content) {
    return SubmissionReceiptResponse.from(
        itemSubmissionService.createItem(
            itemSubmissionService.resolveUser(user), filename, itemType, content));
  }

  @PutMapping("/items/{filename}")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public SubmissionReceiptResponse updateItem(
      @RequestHeader(name = USER_HEADER, required = false) String user,
      @PathVariable("filename") String filename,
      @RequestParam("itemType") String itemType,
      @RequestBody(required = false) byte[] content) {
    return SubmissionReceiptResponse.from(
        itemSubmissionService.updateItem(
            itemSubmissionService.resolveUser(user), filename, itemType, content));
  }

  @DeleteMapping("/items/{filename}")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public SubmissionReceiptResponse deleteItem(
      @RequestHeader(name = USER_HEADER, required = false) String user,
      @PathVariable("filename") String filename,
      @RequestParam("itemType") String itemType) {
    return SubmissionReceiptResponse.from(
        itemSubmissionService.deleteItem(itemSubmissionService.resolveUser(user), filename, itemType));
  }

  @GetMapping("/items")
  public ItemsResponse listItems(
      @RequestHeader(name = USER_HEADER, required = false) String user,
      @RequestParam(name = "filter", required = false) String filter) {
    String owner = itemSubmissionService.resolveUser(user);
    List<String> items =
        switch (ItemFilter.fromString(filter)) {
          case PENDING -> itemSubmissionService.pendingItems(owner);
          case CONFIRMED -> itemSubmissionService.confirmedItems(owner);
        };
    return new ItemsResponse(items);
  }

  @GetMapping("/submissions")
  public List<SubmissionResponse> listSubmissions(
      @RequestHeader(name = USER_HEADER, required = false) String user,
      @RequestParam(name = "status", required = false) String status) {
    return itemSubmissionService.submissions(itemSubmissionService.resolveUser(user), status).stream()
        .map(SubmissionResponse::from)
        .toList();
  }
}
