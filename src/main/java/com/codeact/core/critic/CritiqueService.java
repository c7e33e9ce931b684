package com.codeact.core.critic;

import com.codeact.core.cancellation.CancellationToken;
import com.codeact.core.llm.LlmEmptyResponseException;
import com.codeact.core.llm.LlmParseException;
import com.codeact.core.llm.LlmService;
import com.codeact.core.model.CritiqueVerdict;
import com.codeact.core.model.Turn;
import com.codeact.core.model.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reviews a proposed final answer against the task and the work that led to it.
 * <p>
 * A verdict the critic cannot express (empty or unparseable reply) accepts the answer;
 * provider failures and cancellation propagate to the caller.
 */
@Service
public class CritiqueService {

    private static final Logger log = LoggerFactory.getLogger(CritiqueService.class);

    static final int MAX_TRANSCRIPT_CHARS = 12_000;

    private static final String SYSTEM_PROMPT = """
            You review the work of an autonomous agent that solved a task by writing and running code.
            Decide whether the proposed final answer fully and correctly addresses the task,
            based on the task statement and the evidence in the work log.
            - accepted: true when the answer is complete and supported by the evidence
            - feedback: when rejecting, concrete problems the agent must fix; when accepting, a short note

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;

    public CritiqueService(LlmService llmService) {
        this.llmService = llmService;
    }

    public CritiqueVerdict critique(String task, String proposedAnswer, List<Turn> history, CancellationToken token) {
        String userPrompt = "Task:\n" + task
                + "\n\nWork log:\n" + workLog(history)
                + "\n\nProposed final answer:\n" + proposedAnswer;
        try {
            CritiqueVerdict verdict = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, CritiqueVerdict.class, token);
            if (verdict == null) {
                return CritiqueVerdict.accept("critic returned no verdict");
            }
            log.info("Critique verdict: {}", verdict.accepted() ? "accepted" : "rejected");
            return verdict.feedback() == null ? new CritiqueVerdict(verdict.accepted(), "") : verdict;
        } catch (LlmParseException | LlmEmptyResponseException e) {
            log.warn("Critic produced no usable verdict ({}), accepting the answer", e.getMessage());
            return CritiqueVerdict.accept("critic unavailable: " + e.getMessage());
        }
    }

    /**
     * Keeps the tail of the conversation when it is too long to send in full.
     */
    static String workLog(List<Turn> history) {
        var sb = new StringBuilder();
        for (Turn turn : history) {
            if (turn.role() == TurnRole.USER && turn.index() == 0) {
                continue;
            }
            sb.append('[').append(turn.role().wireName()).append("]\n").append(turn.content()).append("\n\n");
        }
        if (sb.length() <= MAX_TRANSCRIPT_CHARS) {
            return sb.toString();
        }
        return "...(earlier steps omitted)\n" + sb.substring(sb.length() - MAX_TRANSCRIPT_CHARS);
    }
}
