/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.multica.conductor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.multica.conductor.session.StoredSessionUpdate;

/**
 * Formats a stored session history as a text block for the first prompt sent to a
 * restarted agent, which otherwise starts without any memory of the conversation.
 *
 * <p>
 * User messages become {@code USER:} lines. Agent text and tool calls between two user
 * messages become one {@code ASSISTANT:} entry; since message chunks are stored
 * cumulatively the latest chunk wins. When the estimated size exceeds the token budget
 * the oldest messages are dropped.
 */
final class HistoryReplay {

	static final int DEFAULT_MAX_TOKENS = 20000;

	private static final int CHARS_PER_TOKEN = 4;

	private HistoryReplay() {
	}

	record Message(boolean user, String content, List<String> tools) {

		String format() {
			if (this.user) {
				return "USER: " + this.content + "\n";
			}
			String line = "ASSISTANT: " + this.content;
			if (!this.tools.isEmpty()) {
				line += "\n[Used: " + String.join(", ", this.tools) + "]";
			}
			return line + "\n";
		}

	}

	/**
	 * Whether the history holds at least one user message and one agent reply.
	 * @param updates the stored history
	 * @return true if a replay would be meaningful
	 */
	static boolean hasReplayableHistory(List<StoredSessionUpdate> updates) {
		boolean hasUser = false;
		boolean hasAssistant = false;
		for (StoredSessionUpdate update : updates) {
			String kind = update.kind();
			if ("user_message".equals(kind) && !userText(update.inner().get("content")).isEmpty()) {
				hasUser = true;
			}
			else if ("agent_message_chunk".equals(kind) && chunkText(update.inner()) != null) {
				hasAssistant = true;
			}
			if (hasUser && hasAssistant) {
				return true;
			}
		}
		return false;
	}

	static String format(List<StoredSessionUpdate> updates) {
		return format(updates, DEFAULT_MAX_TOKENS);
	}

	/**
	 * Formats the history.
	 * @param updates the stored history
	 * @param maxTokens the size budget
	 * @return the history block, or null when the history has no messages
	 */
	static String format(List<StoredSessionUpdate> updates, int maxTokens) {
		List<Message> messages = extractMessages(updates);
		if (messages.isEmpty()) {
			return null;
		}

		int[] tokens = new int[messages.size()];
		int total = 0;
		for (int i = 0; i < messages.size(); i++) {
			tokens[i] = estimateTokens(messages.get(i).format()) + 1;
			total += tokens[i];
		}

		int start = 0;
		while (start < messages.size() - 1 && total > maxTokens) {
			total -= tokens[start];
			start++;
		}

		String body = messages.subList(start, messages.size())
			.stream()
			.map(Message::format)
			.collect(Collectors.joining("\n"));
		if (start > 0) {
			body = "[" + start + " earlier messages truncated...]\n\n" + body;
		}

		String header = (start > 0)
				? "[Session History - " + messages.size() + " messages, " + start + " truncated]"
				: "[Session History - " + messages.size() + " messages]";
		return header + "\n\n" + body + "\n[End of History]\n\nContinue the conversation. "
				+ "The user's new message follows:\n\n";
	}

	static List<Message> extractMessages(List<StoredSessionUpdate> updates) {
		List<Message> messages = new ArrayList<>();
		String assistant = "";
		List<String> tools = new ArrayList<>();

		for (StoredSessionUpdate update : updates) {
			String kind = update.kind();
			if (kind == null) {
				continue;
			}
			Map<String, Object> inner = update.inner();
			switch (kind) {
				case "user_message" -> {
					if (!assistant.isEmpty() || !tools.isEmpty()) {
						messages.add(new Message(false, assistant, List.copyOf(tools)));
						assistant = "";
						tools.clear();
					}
					String text = userText(inner.get("content"));
					if (!text.isEmpty()) {
						messages.add(new Message(true, text, List.of()));
					}
				}
				case "agent_message_chunk" -> {
					String text = chunkText(inner);
					if (text != null) {
						assistant = text;
					}
				}
				case "tool_call" -> tools.add(toolName(inner));
				default -> {
				}
			}
		}
		if (!assistant.isEmpty() || !tools.isEmpty()) {
			messages.add(new Message(false, assistant, List.copyOf(tools)));
		}
		return messages;
	}

	private static String userText(Object content) {
		if (content instanceof List<?> items) {
			return items.stream()
				.filter(item -> item instanceof Map<?, ?> map && "text".equals(map.get("type")))
				.map(item -> ((Map<?, ?>) item).get("text"))
				.filter(String.class::isInstance)
				.map(String.class::cast)
				.findFirst()
				.orElse("");
		}
		if (content instanceof Map<?, ?> map && map.get("text") instanceof String text) {
			return text;
		}
		return "";
	}

	private static String chunkText(Map<String, Object> inner) {
		if (inner.get("content") instanceof Map<?, ?> content && "text".equals(content.get("type"))
				&& content.get("text") instanceof String text && !text.isEmpty()) {
			return text;
		}
		return null;
	}

	private static String toolName(Map<String, Object> inner) {
		if (inner.get("title") instanceof String title && !title.isEmpty()) {
			return title;
		}
		if (inner.get("name") instanceof String name && !name.isEmpty()) {
			return name;
		}
		return "Unknown tool";
	}

	private static int estimateTokens(String text) {
		return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
	}

}
