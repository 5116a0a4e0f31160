package com.flamingo.ai.smartnotes.exception;

import java.util.Collection;
import java.util.List;

/** Exception thrown when a merge request does not name at least two live topics. */
public class MergeTargetInvalidException extends InputException {

  private final List<String> topicKeys;

  public MergeTargetInvalidException(Collection<String> topicKeys, String reason) {
    super("Invalid merge of " + topicKeys + ": " + reason, reason);
    this.topicKeys = topicKeys == null ? List.of() : List.copyOf(topicKeys);
  }

  public List<String> getTopicKeys() {
    return topicKeys;
  }
}
