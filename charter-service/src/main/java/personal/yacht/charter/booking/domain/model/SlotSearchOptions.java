package personal.yacht.charter.booking.domain.model;

import java.time.LocalDate;

/**
 * 가용 구간 탐색 옵션
 *
 * @param from   탐색 시작일 (포함)
 * @param before 탐색 종료일 (포함)
 */
public record SlotSearchOptions(
        int minDays,
        int maxDays,
        LocalDate from,
        LocalDate before,
        boolean excludeWeekends) {

    public static final int DEFAULT_MIN_DAYS = 1;
    public static final int DEFAULT_MAX_DAYS = 30;
    public static final int DEFAULT_SEARCH_DAYS = 90;

    public SlotSearchOptions {
        if (minDays < 1) {
            minDays = 1;
        }
        if (maxDays < minDays) {
            maxDays = minDays;
        }
    }

    public static SlotSearchOptions between(LocalDate from, LocalDate before) {
        return new SlotSearchOptions(DEFAULT_MIN_DAYS, DEFAULT_MAX_DAYS, from, before, false);
    }

    public static SlotSearchOptions startingAt(LocalDate today) {
        return between(today, today.plusDays(DEFAULT_SEARCH_DAYS));
    }

    public SlotSearchOptions withDays(int newMinDays, int newMaxDays) {
        return new SlotSearchOptions(newMinDays, newMaxDays, from, before, excludeWeekends);
    }

    public SlotSearchOptions excludingWeekends() {
        return new SlotSearchOptions(minDays, maxDays, from, before, true);
    }
}
