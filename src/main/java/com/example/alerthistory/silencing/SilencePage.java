package com.example.alerthistory.silencing;

import java.util.List;

public record SilencePage(List<SilenceView> items, long total, int page, int size) {
}
