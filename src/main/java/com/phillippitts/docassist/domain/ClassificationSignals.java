package com.phillippitts.docassist.domain;

/**
 * Structural indicators computed by the signal extractor for a fetched document.
 *
 * @param appShell               single-page application shell
 * @param dashboard              dashboard-like layout
 * @param search                 search results page
 * @param cart                   shopping cart or checkout
 * @param feed                   generic content feed
 * @param socialFeed             social network feed
 * @param canvasHeavy            rendering dominated by canvas elements
 * @param buttonToParagraphRatio number of buttons per paragraph
 * @param linkDensity            share of text that is link text, 0.0 - 1.0
 * @param textDensity            share of the markup that is readable text, 0.0 - 1.0
 * @param headingCount           number of top-level headings
 * @param hasArticleMarker       an article element or equivalent marker is present
 * @param hasMainMarker          a main-content element or equivalent marker is present
 */
public record ClassificationSignals(
        boolean appShell,
        boolean dashboard,
        boolean search,
        boolean cart,
        boolean feed,
        boolean socialFeed,
        boolean canvasHeavy,
        double buttonToParagraphRatio,
        double linkDensity,
        double textDensity,
        int headingCount,
        boolean hasArticleMarker,
        boolean hasMainMarker
) {

    /** Signals with every indicator absent. */
    public static ClassificationSignals none() {
        return new ClassificationSignals(false, false, false, false, false, false, false,
                0.0, 0.0, 0.0, 0, false, false);
    }

    public boolean hasHeading() {
        return headingCount > 0;
    }

    /** Returns a builder seeded with these values. */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder() {
        return new Builder(none());
    }

    /** Fluent builder, mostly for tests and request mapping. */
    public static final class Builder {
        private boolean appShell;
        private boolean dashboard;
        private boolean search;
        private boolean cart;
        private boolean feed;
        private boolean socialFeed;
        private boolean canvasHeavy;
        private double buttonToParagraphRatio;
        private double linkDensity;
        private double textDensity;
        private int headingCount;
        private boolean hasArticleMarker;
        private boolean hasMainMarker;

        private Builder(ClassificationSignals s) {
            this.appShell = s.appShell;
            this.dashboard = s.dashboard;
            this.search = s.search;
            this.cart = s.cart;
            this.feed = s.feed;
            this.socialFeed = s.socialFeed;
            this.canvasHeavy = s.canvasHeavy;
            this.buttonToParagraphRatio = s.buttonToParagraphRatio;
            this.linkDensity = s.linkDensity;
            this.textDensity = s.textDensity;
            this.headingCount = s.headingCount;
            this.hasArticleMarker = s.hasArticleMarker;
            this.hasMainMarker = s.hasMainMarker;
        }

        public Builder appShell(boolean v) { this.appShell = v; return this; }
        public Builder dashboard(boolean v) { this.dashboard = v; return this; }
        public Builder search(boolean v) { this.search = v; return this; }
        public Builder cart(boolean v) { this.cart = v; return this; }
        public Builder feed(boolean v) { this.feed = v; return this; }
        public Builder socialFeed(boolean v) { this.socialFeed = v; return this; }
        public Builder canvasHeavy(boolean v) { this.canvasHeavy = v; return this; }
        public Builder buttonToParagraphRatio(double v) { this.buttonToParagraphRatio = v; return this; }
        public Builder linkDensity(double v) { this.linkDensity = v; return this; }
        public Builder textDensity(double v) { this.textDensity = v; return this; }
        public Builder headingCount(int v) { this.headingCount = v; return this; }
        public Builder hasArticleMarker(boolean v) { this.hasArticleMarker = v; return this; }
        public Builder hasMainMarker(boolean v) { this.hasMainMarker = v; return this; }

        public ClassificationSignals build() {
            return new ClassificationSignals(appShell, dashboard, search, cart, feed, socialFeed,
                    canvasHeavy, buttonToParagraphRatio, linkDensity, textDensity, headingCount,
                    hasArticleMarker, hasMainMarker);
        }
    }
}
