package io.b2mash.usagereport.exception;

public class GroupNotFoundException extends ReportException {

  public GroupNotFoundException(String groupName) {
    super(
        "Group not found",
        "No group named '" + groupName + "' exists in the identity directory",
        EXIT_FATAL,
        null);
  }
}
