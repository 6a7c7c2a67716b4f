package com.opensciencecatalog.backend.item.service;

import com.opensciencecatalog.backend.config.CatalogItemsProperties;
import com.opensciencecatalog.backend.submission.CatalogRepositoryGateway;
import com.opensciencecatalog.backend.submission.ChangeDescriptor;
import com.opensciencecatalog.backend.submission.ChangeDescriptorCodec;
import com.opensciencecatalog.backend.submission.ChangeKind;
import com.opensciencecatalog.backend.submission.DirectoryEntry;
import com.opensciencecatalog.backend.submission.InvalidSubmissionException;
import com.opensciencecatalog.backend.submission.SubmissionLister;
import com.opensciencecatalog.backend.submission.SubmissionOrchestrator;
import com.opensciencecatalog.backend.submission.SubmissionReceipt;
import com.opensciencecatalog.backend.submission.SubmissionRequest;
import com.opensciencecatalog.backend.submission.SubmissionStatus;
import java.text.Normalizer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Maps catalog item operations onto pull request submissions. Items of a user live at
 * {@code <user>/<filename>} in the catalog repository.
 */
@Service
public class ItemSubmissionService {

  private static final Logger log = LoggerFactory.getLogger(ItemSubmissionService.class);
  private static final Pattern NON_SLUG_CHARACTERS = Pattern.compile("[^a-z0-9]+");
  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

  private final SubmissionOrchestrator orchestrator;
  private final SubmissionLister lister;
  private final ChangeDescriptorCodec codec;
  private final CatalogRepositoryGateway gateway;
  private final CatalogItemsProperties properties;

  public ItemSubmissionService(
      SubmissionOrchestrator orchestrator,
      SubmissionLister lister,
      ChangeDescriptorCodec codec,
      CatalogRepositoryGateway gateway,
      CatalogItemsProperties properties) {
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.lister = Objects.requireNonNull(lister, "lister");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  public SubmissionReceipt createItem(String user, String filename, String itemType, byte[] content) {
    return submit(ChangeKind.ADD, user, filename, itemType, content);
  }

  public SubmissionReceipt updateItem(String user, String filename, String itemType, byte[] content) {
    return submit(ChangeKind.UPDATE, user, filename, itemType, content);
  }

  public SubmissionReceipt deleteItem(String user, String filename, String itemType) {
    return submit(ChangeKind.DELETE, user, filename, itemType, null);
  }

  /** Paths of the user's submissions whose pull request is still open. */
  public List<String> pendingItems(String user) {
    return submissions(user, null).stream()
        .filter(descriptor -> descriptor.status() == SubmissionStatus.PENDING)
        .map(ChangeDescriptor::filename)
        .toList();
  }

  /** Paths of the files stored in the user's directory on the main branch. */
  public List<String> confirmedItems(String user) {
    String directory = requireSegment(user, "user");
    return gateway.listDirectory(gateway.mainBranch(), directory).orElse(List.of()).stream()
        .map(DirectoryEntry::name)
        .sorted()
        .map(name -> directory + "/" + name)
        .toList();
  }

  public List<ChangeDescriptor> submissions(String user, String status) {
    String owner = requireSegment(user, "user");
    Optional<SubmissionStatus> statusFilter = parseStatus(status);
    try (Stream<ChangeDescriptor> descriptors = lister.listFor(Optional.of(owner))) {
      return descriptors
          .filter(descriptor -> statusFilter.map(s -> s == descriptor.status()).orElse(true))
          .toList();
    }
  }

  public String resolveUser(String requestedUser) {
    String user = StringUtils.hasText(requestedUser) ? requestedUser : properties.getDefaultUser();
    return requireSegment(user, "user");
  }

  private SubmissionReceipt submit(
      ChangeKind kind, String user, String filename, String itemType, byte[] content) {
    String owner = requireSegment(user, "user");
    String name = requireSegment(filename, "filename");
    if (!StringUtils.hasText(itemType)) {
      throw new InvalidSubmissionException("itemType must not be blank");
    }
    String path = owner + "/" + name;
    boolean dataOwner = properties.isDataOwner(owner);
    ChangeDescriptor descriptor =
        ChangeDescriptor.proposed(path, itemType.trim(), kind, owner, dataOwner);

    SubmissionRequest request =
        new SubmissionRequest(
            branchBaseName(kind, path),
            kind.wireValue() + " " + path,
            codec.encode(descriptor),
            kind == ChangeKind.DELETE ? null : new SubmissionRequest.FileToCreate(path, content),
            kind == ChangeKind.DELETE ? path : null,
            labels(dataOwner));
    log.info(
        "catalog.items.{} user={} path={} dataOwner={}",
        kind.name().toLowerCase(Locale.ROOT),
        owner,
        path,
        dataOwner);
    return orchestrator.submit(request);
  }

  private Set<String> labels(boolean dataOwner) {
    Set<String> labels = new LinkedHashSet<>();
    properties.getLabels().stream()
        .filter(StringUtils::hasText)
        .map(String::trim)
        .forEach(labels::add);
    if (dataOwner && StringUtils.hasText(properties.getDataOwnerLabel())) {
      labels.add(properties.getDataOwnerLabel().trim());
    }
    return labels;
  }

  String branchBaseName(ChangeKind kind, String path) {
    String normalized =
        DIACRITICS
            .matcher(Normalizer.normalize(kind.wireValue() + "-" + path, Normalizer.Form.NFKD))
            .replaceAll("")
            .toLowerCase(Locale.ROOT);
    String slug = NON_SLUG_CHARACTERS.matcher(normalized).replaceAll("-");
    slug = trimDashes(slug);
    int maxLength = Math.max(1, properties.getBranchNameMaxLength());
    if (slug.length() > maxLength) {
      slug = trimDashes(slug.substring(0, maxLength));
    }
    if (slug.isEmpty()) {
      throw new InvalidSubmissionException("Cannot derive a branch name from '" + path + "'");
    }
    return slug;
  }

  private static String trimDashes(String value) {
    int start = 0;
    int end = value.length();
    while (start < end && value.charAt(start) == '-') {
      start++;
    }
    while (end > start && value.charAt(end - 1) == '-') {
      end--;
    }
    return value.substring(start, end);
  }

  private static String requireSegment(String value, String field) {
    if (!StringUtils.hasText(value)) {
      throw new InvalidSubmissionException(field + " must not be blank");
    }
    String trimmed = value.trim();
    if (trimmed.contains("/") || trimmed.contains("\\") || trimmed.startsWith(".")) {
      throw new InvalidSubmissionException(
          field + " must be a single path segment not starting with '.', got '" + value + "'");
    }
    return trimmed;
  }

  private static Optional<SubmissionStatus> parseStatus(String status) {
    if (!StringUtils.hasText(status)) {
      return Optional.empty();
    }
    for (SubmissionStatus candidate : SubmissionStatus.values()) {
      if (candidate.displayName().equalsIgnoreCase(status.trim())) {
        return Optional.of(candidate);
      }
    }
    throw new InvalidSubmissionException("Unsupported submission status '" + status + "'");
  }
}
