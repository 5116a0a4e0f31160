package com.flamingo.ai.smartnotes.domain.enums;

/** Author of a chat turn. */
public enum ChatSender {
  USER,
  ASSISTANT
}
