package me.golemcore.runtime.domain.compaction;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * The eight focused extraction passes of {@code AUTO_COMPACT}. Each pass reads
 * the whole transcript and returns one section of the merged summary.
 */
public enum ExtractionSection {

    TECHNICAL_CONTEXT("## Technical Context",
            "a technical architect recording the environment a developer is working in",
            """
                    Extract the technical environment needed to continue the work:
                    - operating system, runtimes and tool versions
                    - languages, frameworks and libraries with exact versions
                    - project layout: directories, modules, entry points, configuration files
                    - build, test and run commands and their output locations
                    - environment variables, services and endpoints in use
                    Use bullet points. Quote exact versions, paths and values."""),

    CODE_CHANGES("## Code Changes & Modifications",
            "a code reviewer recording every code change made in a session",
            """
                    Extract every code change:
                    - files created, with full path and purpose
                    - files modified, as path:line references, with what changed and why
                    - functions, classes and types added or changed, with signatures
                    - imports or dependencies added, files or code deleted
                    Include short code snippets in fenced blocks where they matter."""),

    ERRORS_AND_DEBUGGING("## Debugging & Error Resolution",
            "a debugging specialist recording problems and how they were solved",
            """
                    Extract every error, failure and warning:
                    - exact message and type, with file and line when known
                    - root cause
                    - the fix that worked and how it was verified
                    - attempts that did not work and why
                    Mark problems that are still unresolved as OPEN."""),

    DECISIONS("## Important Decisions & Rationale",
            "a decision analyst recording the choices made during a session",
            """
                    Extract each significant decision:
                    - what was decided
                    - why, and which alternatives were rejected
                    - trade-offs accepted and constraints that drove them
                    Keep one bullet group per decision."""),

    PERFORMANCE("## Performance & Metrics",
            "a performance analyst recording measurements from a session",
            """
                    Extract every number that was measured or targeted:
                    - timings, sizes, throughput, token counts, memory figures
                    - before/after comparisons
                    - bottlenecks found and optimizations applied
                    Report exact figures with units. Write "None recorded" if nothing was measured."""),

    DEPENDENCIES("## Dependencies & Integrations",
            "an integration engineer recording external dependencies of a project",
            """
                    Extract external dependencies and integrations:
                    - packages added, removed or upgraded, with versions
                    - external APIs, services, databases and their endpoints
                    - authentication or configuration each integration needs
                    - known compatibility issues"""),

    USER_PREFERENCES("## User Preferences & Context",
            "an assistant recording how the user likes to work",
            """
                    Extract the user's stated or shown preferences:
                    - coding style, naming and formatting conventions
                    - tools, libraries or approaches they asked for or rejected
                    - communication preferences and instructions to keep following
                    Quote the user's own words where possible."""),

    CURRENT_STATUS("## Current Status & Completion",
            "a project manager recording where the work stands",
            """
                    Extract the current state of the work:
                    - what is done and verified
                    - what is in progress, including the exact next step
                    - what is blocked and on what
                    - open questions for the user
                    End with the single most important next action.""");

    private final String title;
    private final String role;
    private final String instructions;

    ExtractionSection(String title, String role, String instructions) {
        this.title = title;
        this.role = role;
        this.instructions = instructions;
    }

    public String getTitle() {
        return title;
    }

    public String systemPrompt() {
        return "You are " + role + ". You read a transcript of a conversation between a user, "
                + "an AI assistant and its tools, and extract one category of information so that the "
                + "work can continue after the transcript is discarded. Be specific and factual. "
                + "Do not invent details. Output markdown without a top-level heading.";
    }

    public String instructions() {
        return instructions;
    }
}
