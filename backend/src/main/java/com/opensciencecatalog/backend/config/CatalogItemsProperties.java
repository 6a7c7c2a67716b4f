package com.opensciencecatalog.backend.config;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catalog.items")
public class CatalogItemsProperties {

  private String defaultUser = "my-user";
  private Set<String> dataOwners = new LinkedHashSet<>();
  private List<String> labels = new ArrayList<>();
  private String dataOwnerLabel = "data-owner";
  private int branchNameMaxLength = 30;

  public boolean isDataOwner(String user) {
    return user != null && dataOwners.contains(user);
  }

  public String getDefaultUser() {
    return defaultUser;
  }

  public void setDefaultUser(String defaultUser) {
    this.defaultUser = defaultUser;
  }

  public Set<String> getDataOwners() {
    return dataOwners;
  }

  public void setDataOwners(Set<String> dataOwners) {
    this.dataOwners = dataOwners != null ? dataOwners : new LinkedHashSet<>();
  }

  public List<String> getLabels() {
    return labels;
  }

  public void setLabels(List<String> labels) {
    this.labels = labels != null ? labels : new ArrayList<>();
  }

  public String getDataOwnerLabel() {
    return dataOwnerLabel;
  }

  public void setDataOwnerLabel(String dataOwnerLabel) {
    this.dataOwnerLabel = dataOwnerLabel;
  }

  public int getBranchNameMaxLength() {
    return branchNameMaxLength;
  }

  public void setBranchNameMaxLength(int branchNameMaxLength) {
    this.branchNameMaxLength = branchNameMaxLength;
  }
}
