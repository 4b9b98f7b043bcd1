package com.phillippitts.docassist.config.properties;

import com.phillippitts.docassist.domain.PolicyConfiguration;
import com.phillippitts.docassist.domain.PolicyMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Default processing policy, used to seed the policy store.
 *
 * <p>The default lists allow news, documentation and reference hosts and deny mail, chat,
 * shopping, social, search, dashboard and admin surfaces. Matching is substring containment
 * on the source locator.
 */
@ConfigurationProperties(prefix = "classification")
@Validated
public class ClassificationProperties {

    public static final List<String> DEFAULT_ALLOW_LIST = List.of(
            "nytimes.com", "theguardian.com", "bbc.com", "cnn.com", "reuters.com", "apnews.com", "npr.org",
            "wsj.com", "arstechnica.com", "techcrunch.com", "theverge.com", "wired.com", "engadget.com",
            "thenextweb.com", "medium.com", "substack.com", "dev.to", "hashnode.com",
            "docs.", "documentation.", "developer.", "api.", "guide.", "docs.github.com",
            "developer.mozilla.org", "stackoverflow.com", ".edu", "arxiv.org", "scholar.google.com",
            "wikipedia.org", "wikimedia.org", "news.ycombinator.com", "reddit.com");

    public static final List<String> DEFAULT_DENY_LIST = List.of(
            "mail.google.com", "gmail.com", "calendar.google.com", "drive.google.com",
            "app.slack.com", "web.whatsapp.com", "trello.com", "asana.com", "notion.so",
            "amazon.com", "ebay.com", "etsy.com", "shopify.", "cart", "checkout",
            "twitter.com", "x.com", "facebook.com", "instagram.com", "tiktok.com", "linkedin.com",
            "youtube.com", "search?", "/search", "results?", "dashboard", "admin", "console", "panel",
            "localhost");

    /** Processing mode applied until the user changes it. */
    @NotNull
    private PolicyMode mode = PolicyMode.MANUAL;

    private List<String> allowList = new ArrayList<>(DEFAULT_ALLOW_LIST);

    private List<String> denyList = new ArrayList<>(DEFAULT_DENY_LIST);

    /** Word count required for unassisted automatic processing. */
    @Min(0)
    private int minAutoWords = 500;

    /** Word count required for allow-listed automatic processing and assisted prompts. */
    @Min(0)
    private int minPromptWords = 250;

    public PolicyConfiguration toPolicy() {
        return new PolicyConfiguration(mode, allowList, denyList, minAutoWords, minPromptWords);
    }

    public PolicyMode getMode() {
        return mode;
    }

    public void setMode(PolicyMode mode) {
        this.mode = mode;
    }

    public List<String> getAllowList() {
        return allowList;
    }

    public void setAllowList(List<String> allowList) {
        this.allowList = allowList;
    }

    public List<String> getDenyList() {
        return denyList;
    }

    public void setDenyList(List<String> denyList) {
        this.denyList = denyList;
    }

    public int getMinAutoWords() {
        return minAutoWords;
    }

    public void setMinAutoWords(int minAutoWords) {
        this.minAutoWords = minAutoWords;
    }

    public int getMinPromptWords() {
        return minPromptWords;
    }

    public void setMinPromptWords(int minPromptWords) {
        this.minPromptWords = minPromptWords;
    }
}
