package com.opensciencecatalog.backend.item.api;

import com.opensciencecatalog.backend.submission.SubmissionReceipt;

public record SubmissionReceiptResponse(String branch, int pullRequestNumber, String pullRequestUrl) {

  public static SubmissionReceiptResponse from(SubmissionReceipt receipt) {
    return new SubmissionReceiptResponse(
        receipt.branch(), receipt.pullRequestNumber(), receipt.pullRequestUrl());
  }
}
