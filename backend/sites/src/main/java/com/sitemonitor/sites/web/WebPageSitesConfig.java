package com.sitemonitor.sites.web;

import java.util.List;

public record WebPageSitesConfig(List<WebPageSiteConfig> sites) {
    public static WebPageSitesConfig empty() {
        return new WebPageSitesConfig(List.of());
    }

    public List<WebPageSiteConfig> sitesOrEmpty() {
        return sites == null ? List.of() : sites;
    }
}
