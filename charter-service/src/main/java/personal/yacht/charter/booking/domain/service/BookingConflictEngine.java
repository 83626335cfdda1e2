package personal.yacht.charter.booking.domain.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import personal.yacht.charter.booking.domain.model.AlternativeSuggestions;
import personal.yacht.charter.booking.domain.model.AlternativeSuggestions.AlternativeDate;
import personal.yacht.charter.booking.domain.model.AlternativeSuggestions.AlternativeResource;
import personal.yacht.charter.booking.domain.model.AvailabilityResult;
import personal.yacht.charter.booking.domain.model.AvailabilitySlot;
import personal.yacht.charter.booking.domain.model.Conflict;
import personal.yacht.charter.booking.domain.model.ConflictCheckOptions;
import personal.yacht.charter.booking.domain.model.ConflictCheckResult;
import personal.yacht.charter.booking.domain.model.ConflictWarning;
import personal.yacht.charter.booking.domain.model.DateValidationOptions;
import personal.yacht.charter.booking.domain.model.DateValidationResult;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationType;
import personal.yacht.charter.booking.domain.model.ResourceSpec;
import personal.yacht.charter.booking.domain.model.SlotSearchOptions;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static java.time.temporal.ChronoUnit.DAYS;

/**
 * Booking Conflict Engine
 * 예약 충돌 및 가용성 계산 (상태 없음)
 *
 * <p>모든 비교는 일 단위로 정규화하며 시작일과 종료일을 모두 포함한다.
 * 같은 날 체크아웃/체크인도 겹침으로 본다.
 * 입력 컬렉션은 읽기만 하며, 예상된 상황(충돌, 검증 오류)은 예외 대신 결과 객체로 반환한다.
 */
@Component
@RequiredArgsConstructor
public class BookingConflictEngine {

    private static final int ALTERNATIVE_DAYS_BEFORE = 14;
    private static final int ALTERNATIVE_DAYS_AFTER = 30;
    private static final int ALTERNATIVE_EXTRA_DAYS = 7;
    private static final int NEARBY_WINDOW_DAYS = 7;
    private static final int NEARBY_FLEX_DAYS = 2;
    private static final int MAX_NEARBY_SLOTS = 4;

    private final Clock clock;

    // ========== Interval ==========

    public boolean overlaps(LocalDateTime startA, LocalDateTime endA, LocalDateTime startB, LocalDateTime endB) {
        return overlaps(startA.toLocalDate(), endA.toLocalDate(), startB.toLocalDate(), endB.toLocalDate());
    }

    public boolean overlaps(LocalDate startA, LocalDate endA, LocalDate startB, LocalDate endB) {
        return !startA.isAfter(endB) && !startB.isAfter(endA);
    }

    // ========== Conflict Detection ==========

    /**
     * 후보 예약과 기존 예약들의 충돌 검사
     *
     * <p>같은 요트의 활성 예약만 비교하며 후보 자신의 ID는 제외한다(수정 시 재검사 지원).
     * 겹치지 않고 하루 차이로 붙어 있으면 back-to-back 경고를 남긴다.
     *
     * @param candidate 검사할 예약
     * @param existing  기존 예약 목록
     * @param options   검사 옵션
     * @return 충돌 및 경고 목록
     */
    public ConflictCheckResult checkConflicts(Reservation candidate, Collection<Reservation> existing,
                                              ConflictCheckOptions options) {
        List<Conflict> conflicts = new ArrayList<>();
        List<ConflictWarning> warnings = new ArrayList<>();

        for (Reservation other : existing) {
            if (!isComparable(candidate, other, options)) {
                continue;
            }
            if (overlaps(candidate.startDate(), candidate.endDate(), other.startDate(), other.endDate())) {
                if (options.excludeSameDay() && isSameDayTransition(candidate, other)) {
                    warnings.add(ConflictWarning.sameDayTransition(other));
                } else {
                    conflicts.add(Conflict.of(other, overlapDays(candidate, other)));
                }
            } else if (isAdjacent(candidate, other)) {
                warnings.add(ConflictWarning.backToBack(other));
            }
        }
        return new ConflictCheckResult(conflicts, warnings);
    }

    // ========== Availability ==========

    /**
     * 특정 일자의 가용성
     * 해당 일자를 포함하는 첫 번째 활성 예약으로 상태를 결정한다.
     */
    public AvailabilityResult dateAvailability(LocalDate date, String resourceId,
                                               Collection<Reservation> reservations) {
        for (Reservation reservation : reservations) {
            if (reservation.isOn(resourceId) && reservation.isActive() && reservation.occupies(date)) {
                return AvailabilityResult.occupied(date, resourceId, reservation);
            }
        }
        return AvailabilityResult.available(date, resourceId);
    }

    public List<AvailabilityResult> rangeAvailability(LocalDate start, LocalDate end, String resourceId,
                                                      Collection<Reservation> reservations) {
        List<Reservation> relevant = activeOn(resourceId, reservations);
        List<AvailabilityResult> results = new ArrayList<>();
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            results.add(dateAvailability(date, resourceId, relevant));
        }
        return results;
    }

    /**
     * 가용 구간 탐색
     *
     * <p>from부터 하루씩 전진하며, 가용일을 만나면 maxDays에 닿거나 비가용일을 만날 때까지 늘린다.
     * minDays 이상인 구간만 반환하고, 구간 다음 날부터 탐색을 이어간다.
     */
    public List<AvailabilitySlot> findAvailableSlots(String resourceId, Collection<Reservation> reservations,
                                                     SlotSearchOptions options) {
        List<Reservation> relevant = activeOn(resourceId, reservations);
        List<AvailabilitySlot> slots = new ArrayList<>();

        LocalDate day = options.from();
        while (!day.isAfter(options.before())) {
            if (!dateAvailability(day, resourceId, relevant).isAvailable()) {
                day = day.plusDays(1);
                continue;
            }

            LocalDate slotEnd = day;
            int length = 1;
            while (length < options.maxDays()) {
                LocalDate next = slotEnd.plusDays(1);
                if (next.isAfter(options.before()) || !dateAvailability(next, resourceId, relevant).isAvailable()) {
                    break;
                }
                slotEnd = next;
                length++;
            }

            if (length >= options.minDays()) {
                boolean weekend = includesWeekend(day, slotEnd);
                if (!(options.excludeWeekends() && weekend)) {
                    slots.add(new AvailabilitySlot(resourceId, day, slotEnd, length, weekend));
                }
            }
            day = slotEnd.plusDays(1);
        }
        return slots;
    }

    public List<AvailabilitySlot> findAvailableSlots(String resourceId, Collection<Reservation> reservations) {
        return findAvailableSlots(resourceId, reservations, SlotSearchOptions.startingAt(LocalDate.now(clock)));
    }

    // ========== Alternatives ==========

    /**
     * 충돌 시 대안 제안
     * 1. 같은 요트의 다른 날짜 (요청 전 14일 ~ 후 30일, 원래 시작일과 가까운 순)
     * 2. 같은 기간의 다른 요트 (충돌 없는 요트만)
     * 3. 요청 기간 바로 앞/뒤 7일 안의 가까운 구간 (날짜순)
     */
    public AlternativeSuggestions suggestAlternatives(Reservation requested, Collection<Reservation> reservations,
                                                      Collection<ResourceSpec> resources) {
        LocalDate start = requested.startDate();
        LocalDate end = requested.endDate();
        int duration = (int) DAYS.between(start, end) + 1;
        List<Reservation> others = reservations.stream()
                .filter(reservation -> !reservation.id().equals(requested.id()))
                .toList();

        SlotSearchOptions dateWindow = SlotSearchOptions
                .between(start.minusDays(ALTERNATIVE_DAYS_BEFORE), end.plusDays(ALTERNATIVE_DAYS_AFTER))
                .withDays(duration, duration + ALTERNATIVE_EXTRA_DAYS);
        List<AlternativeDate> alternativeDates = findAvailableSlots(requested.resourceId(), others, dateWindow)
                .stream()
                .map(slot -> new AlternativeDate(
                        slot.resourceId(),
                        slot.startDate(),
                        slot.startDate().plusDays(duration - 1L),
                        duration,
                        Math.abs(DAYS.between(start, slot.startDate()))))
                .sorted(Comparator.comparingLong(AlternativeDate::daysDifference))
                .limit(AlternativeSuggestions.MAX_SUGGESTIONS)
                .toList();

        List<AlternativeResource> alternativeResources = resources.stream()
                .filter(resource -> !resource.id().equals(requested.resourceId()))
                .filter(resource -> isFreeOn(resource, requested, others))
                .map(resource -> new AlternativeResource(resource, start, end))
                .limit(AlternativeSuggestions.MAX_SUGGESTIONS)
                .toList();

        int nearbyMin = Math.max(1, duration - NEARBY_FLEX_DAYS);
        int nearbyMax = duration + NEARBY_FLEX_DAYS;
        List<AvailabilitySlot> before = findAvailableSlots(requested.resourceId(), others,
                SlotSearchOptions.between(start.minusDays(NEARBY_WINDOW_DAYS), start.minusDays(1))
                        .withDays(nearbyMin, nearbyMax));
        List<AvailabilitySlot> after = findAvailableSlots(requested.resourceId(), others,
                SlotSearchOptions.between(end.plusDays(1), end.plusDays(NEARBY_WINDOW_DAYS))
                        .withDays(nearbyMin, nearbyMax));
        List<AvailabilitySlot> nearbySlots = Stream.concat(before.stream(), after.stream())
                .sorted(Comparator.comparing(AvailabilitySlot::startDate))
                .limit(MAX_NEARBY_SLOTS)
                .toList();

        return new AlternativeSuggestions(alternativeDates, alternativeResources, nearbySlots);
    }

    // ========== Date Validation ==========

    /**
     * 예약 기간 검증
     * 같은 입력이면 항상 같은 결과를 낸다 (기준일은 주입된 Clock).
     */
    public DateValidationResult validateDates(LocalDate start, LocalDate end, DateValidationOptions options) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (start == null || end == null) {
            errors.add("Start and end dates are required");
            return new DateValidationResult(errors, warnings, 0, 0);
        }

        LocalDate today = LocalDate.now(clock);
        if (end.isBefore(start)) {
            errors.add("End date must be after start date");
        }
        if (!options.allowPast() && start.isBefore(today)) {
            errors.add("Cannot book dates in the past");
        }

        long bookingDays = DAYS.between(start, end) + 1;
        if (bookingDays < options.minDays()) {
            errors.add(String.format("Minimum booking duration is %d days", options.minDays()));
        }
        if (bookingDays > options.maxDays()) {
            errors.add(String.format("Maximum booking duration is %d days", options.maxDays()));
        }

        long daysInAdvance = DAYS.between(today, start);
        if (daysInAdvance >= 0 && daysInAdvance < options.minAdvanceDays()) {
            errors.add(String.format("Bookings must be made at least %d days in advance", options.minAdvanceDays()));
        }
        if (daysInAdvance > options.maxAdvanceDays()) {
            errors.add(String.format("Cannot book more than %d days in advance", options.maxAdvanceDays()));
        }

        if (bookingDays == 1) {
            warnings.add("Single-day booking - consider turnaround time");
        }
        if (includesWeekend(start, end)) {
            warnings.add("Booking includes weekend days");
        }
        return new DateValidationResult(errors, warnings, bookingDays, daysInAdvance);
    }

    // ========== Internal ==========

    private boolean isComparable(Reservation candidate, Reservation other, ConflictCheckOptions options) {
        return other.isOn(candidate.resourceId())
                && !other.id().equals(candidate.id())
                && other.isActive()
                && (options.includeBlocked() || other.type() != ReservationType.BLOCKED);
    }

    /**
     * 한쪽의 종료일에 다른 쪽이 시작하는, 정확히 하루짜리 경계 겹침
     */
    private boolean isSameDayTransition(Reservation candidate, Reservation other) {
        boolean checkinOnCheckout = candidate.startDate().equals(other.endDate())
                && candidate.endDate().isAfter(other.endDate());
        boolean checkoutOnCheckin = candidate.endDate().equals(other.startDate())
                && candidate.startDate().isBefore(other.startDate());
        return checkinOnCheckout || checkoutOnCheckin;
    }

    private boolean isAdjacent(Reservation candidate, Reservation other) {
        return candidate.endDate().plusDays(1).equals(other.startDate())
                || other.endDate().plusDays(1).equals(candidate.startDate());
    }

    private int overlapDays(Reservation a, Reservation b) {
        LocalDate from = a.startDate().isAfter(b.startDate()) ? a.startDate() : b.startDate();
        LocalDate to = a.endDate().isBefore(b.endDate()) ? a.endDate() : b.endDate();
        return (int) DAYS.between(from, to) + 1;
    }

    private boolean isFreeOn(ResourceSpec resource, Reservation requested, List<Reservation> others) {
        List<Reservation> pool = new ArrayList<>(others);
        pool.addAll(resource.maintenanceBlocks());
        return !checkConflicts(requested.relocatedTo(resource.id()), pool, ConflictCheckOptions.defaults())
                .hasConflicts();
    }

    private List<Reservation> activeOn(String resourceId, Collection<Reservation> reservations) {
        return reservations.stream()
                .filter(reservation -> reservation.isOn(resourceId) && reservation.isActive())
                .toList();
    }

    private boolean includesWeekend(LocalDate start, LocalDate end) {
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            DayOfWeek day = date.getDayOfWeek();
            if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
                return true;
            }
        }
        return false;
    }
}
