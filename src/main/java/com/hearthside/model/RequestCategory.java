package com.hearthside.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of assistant request. Selects the system prompt sent ahead of the user's turn
 * and is part of the cache fingerprint.
 */
public enum RequestCategory {

    RECIPE_RECOMMENDATION("recipe_recommendation",
            "You are a cooking assistant. Recommend recipes that use the ingredients the family already has."),

    MEAL_PLANNING("meal_planning",
            "You are a family meal planner. Propose balanced, practical meal plans."),

    SHOPPING_LIST("shopping_list",
            "You are a shopping assistant. Build a categorised shopping list that avoids items already in stock."),

    TASK_SUGGESTION("task_suggestion",
            "You are a household organiser. Suggest chores and assign them sensibly among family members."),

    SCHEDULE_ANALYSIS("schedule_analysis",
            "You are a time management assistant. Find conflicts and free slots in the family schedule."),

    GENERAL_ASSISTANT("general_assistant",
            "You are a friendly family assistant. Answer clearly and concisely.");

    private final String value;
    private final String systemPrompt;

    RequestCategory(String value, String systemPrompt) {
        this.value = value;
        this.systemPrompt = systemPrompt;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    /**
     * Parse the wire value ("meal_planning"). Also accepts the constant name.
     *
     * @throws IllegalArgumentException for unknown categories
     */
    @JsonCreator
    public static RequestCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RequestCategory category : values()) {
            if (category.value.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown request category: " + value);
    }
}
