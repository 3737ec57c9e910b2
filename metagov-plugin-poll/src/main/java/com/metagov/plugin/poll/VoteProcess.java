package com.metagov.plugin.poll;

import com.metagov.errors.InvalidParametersException;
import com.metagov.errors.PluginInternalException;
import com.metagov.identity.LinkOptions;
import com.metagov.identity.LinkQuality;
import com.metagov.identity.LinkType;
import com.metagov.plugin.ProcessContext;
import com.metagov.plugin.ProcessDefinition;
import com.metagov.plugin.ProcessStatus;
import com.metagov.schema.JsonSchema;
import com.metagov.schema.Parameters;
import com.metagov.state.KeyValueStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * "vote" process of the poll plugin. Webhooks carry the poll's {@code voteId} and either a single
 * ballot ({@code voter}, {@code vote}) or the final {@code result}. Without a result webhook the vote
 * closes at {@code closing_at} on the next update, or on close, with the option that has the most
 * ballots (earlier option wins a tie).
 */
final class VoteProcess implements ProcessDefinition {

    private static final Logger log = LoggerFactory.getLogger(VoteProcess.class);

    static final String NAME = "vote";

    private static final String STATE_VOTE_ID = "vote_id";
    private static final String STATE_OPTIONS = "options";
    private static final String STATE_CLOSING_AT = "closing_at";
    private static final String STATE_BALLOTS = "ballots";

    static final JsonSchema INPUT_SCHEMA = JsonSchema.parse("""
            {
              "type": "object",
              "properties": {
                "title": {"type": "string", "minLength": 1},
                "options": {"type": "array", "items": {"type": "string"}, "minItems": 2, "default": ["yes", "no"]},
                "closing_at": {"type": "string"}
              },
              "required": ["title"]
            }
            """);

    static final JsonSchema OUTCOME_SCHEMA = JsonSchema.parse("""
            {
              "type": "object",
              "properties": {
                "url": {"type": "string"},
                "vote_id": {"type": "string"},
                "votes": {"type": "object"},
                "result": {"type": ["string", "null"]}
              }
            }
            """);

    private final String baseUrl;
    private final Clock clock;

    VoteProcess(String baseUrl, Clock clock) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Yes/no or multiple choice vote on a hosted poll";
    }

    @Override
    public JsonSchema getInputSchema() {
        return INPUT_SCHEMA;
    }

    @Override
    public JsonSchema getOutcomeSchema() {
        return OUTCOME_SCHEMA;
    }

    @Override
    public void start(ProcessContext process, Parameters parameters) {
        String closingAt = parameters.getString("closing_at");
        if (closingAt != null) {
            try {
                Instant.parse(closingAt);
            } catch (DateTimeParseException e) {
                throw new InvalidParametersException(PollPluginProvider.NAME + "." + NAME,
                        List.of("$.closing_at: must be an ISO-8601 instant"));
            }
        }
        String voteId = UUID.randomUUID().toString();
        KeyValueStateStore state = process.getState();
        state.set(STATE_VOTE_ID, voteId);
        state.set(STATE_OPTIONS, parameters.get("options"));
        state.set(STATE_BALLOTS, Map.of());
        if (closingAt != null) {
            state.set(STATE_CLOSING_AT, closingAt);
        }
        String url = baseUrl + "/votes/" + voteId;
        process.setUrl(url);
        Map<String, Object> outcome = new LinkedHashMap<>();
        outcome.put("url", url);
        outcome.put("vote_id", voteId);
        outcome.put("title", parameters.getString("title"));
        outcome.put("votes", counts(state));
        process.setOutcome(outcome);
        process.setStatus(ProcessStatus.PENDING);
        process.save();
        process.getPlugin().sendEventToDriver("vote_started", Map.of("vote_id", voteId, "url", url), null);
    }

    @Override
    public void close(ProcessContext process) {
        complete(process, tally(process));
    }

    @Override
    public void receiveWebhook(ProcessContext process, Map<String, Object> payload) {
        KeyValueStateStore state = process.getState();
        if (!Objects.equals(state.get(STATE_VOTE_ID), payload.get("voteId"))) {
            return;
        }
        Object voter = payload.get("voter");
        Object vote = payload.get("vote");
        if (voter != null && vote != null) {
            requireOption(state, vote.toString());
            Map<String, Object> ballots = ballots(state);
            ballots.put(voter.toString(), vote.toString());
            state.set(STATE_BALLOTS, ballots);
            process.getPlugin().addLinkedAccount(voter.toString(), LinkOptions.of(LinkType.UNKNOWN, LinkQuality.UNCONFIRMED));
            Map<String, Object> outcome = new LinkedHashMap<>(process.getOutcome());
            outcome.put("votes", counts(state));
            process.setOutcome(outcome);
            log.debug("Recorded ballot of {} on vote {}", voter, state.get(STATE_VOTE_ID));
        }
        Object result = payload.get("result");
        if (result != null) {
            requireOption(state, result.toString());
            complete(process, result.toString());
        }
    }

    @Override
    public void update(ProcessContext process) {
        Object closingAt = process.getState().get(STATE_CLOSING_AT);
        if (closingAt != null && !clock.instant().isBefore(Instant.parse(closingAt.toString()))) {
            complete(process, tally(process));
        }
    }

    private void complete(ProcessContext process, String result) {
        Map<String, Object> outcome = new LinkedHashMap<>(process.getOutcome());
        outcome.put("votes", counts(process.getState()));
        outcome.put("result", result);
        process.setOutcome(outcome);
        process.setStatus(ProcessStatus.COMPLETED);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("vote_id", process.getState().get(STATE_VOTE_ID));
        data.put("result", result);
        process.getPlugin().sendEventToDriver("vote_closed", data, null);
    }

    /** Winning option, or null when nobody voted. */
    private static String tally(ProcessContext process) {
        Map<String, Object> counts = counts(process.getState());
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Object> e : counts.entrySet()) {
            int n = ((Number) e.getValue()).intValue();
            if (n > best) {
                best = n;
                winner = e.getKey();
            }
        }
        return winner;
    }

    private static Map<String, Object> counts(KeyValueStateStore state) {
        Map<String, Object> counts = new LinkedHashMap<>();
        for (String option : options(state)) {
            counts.put(option, 0);
        }
        for (Object vote : ballots(state).values()) {
            counts.merge(vote.toString(), 1, (a, b) -> ((Number) a).intValue() + ((Number) b).intValue());
        }
        return counts;
    }

    @SuppressWarnings("unchecked")
    private static List<String> options(KeyValueStateStore state) {
        Object options = state.get(STATE_OPTIONS);
        return options instanceof List ? (List<String>) options : List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> ballots(KeyValueStateStore state) {
        Object ballots = state.get(STATE_BALLOTS);
        return ballots instanceof Map ? new LinkedHashMap<>((Map<String, Object>) ballots) : new LinkedHashMap<>();
    }

    private static void requireOption(KeyValueStateStore state, String value) {
        if (!options(state).contains(value)) {
            throw new PluginInternalException("invalid_option", "Poll sent '" + value + "' which is not an option",
                    Map.of("options", options(state)), null);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
