package personal.yacht.charter.booking.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.yacht.common.exception.BusinessException;
import personal.yacht.common.exception.ErrorCode;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static personal.yacht.charter.support.ReservationFixtures.CREATED_AT;
import static personal.yacht.charter.support.ReservationFixtures.confirmed;
import static personal.yacht.charter.support.ReservationFixtures.draft;

@DisplayName("Reservation 도메인 모델 테스트")
class ReservationTest {

    private static final Instant NOW = Instant.parse("2025-05-02T10:00:00Z");

    @Test
    @DisplayName("ID가 비어 있으면 생성할 수 없다")
    void create_BlankId() {
        assertThatThrownBy(() -> confirmed(" ", "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_INPUT);
    }

    @Test
    @DisplayName("초안에서 생성하면 기본값이 채워지고 이력은 비어 있다")
    void fromDraft_Defaults() {
        // given
        ReservationDraft request = draft(null, "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12))
                .toBuilder()
                .status(null)
                .type(null)
                .build();

        // when
        Reservation reservation = Reservation.fromDraft("r-1", request, NOW);

        // then
        assertThat(reservation.id()).isEqualTo("r-1");
        assertThat(reservation.status()).isEqualTo(ReservationStatus.PENDING);
        assertThat(reservation.type()).isEqualTo(ReservationType.CHARTER);
        assertThat(reservation.depositPaid()).isFalse();
        assertThat(reservation.changeHistory()).isEmpty();
        assertThat(reservation.createdAt()).isEqualTo(NOW);
        assertThat(reservation.updatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("부분 변경 - 바뀐 필드만 이력에 남는다")
    void applyPatch_RecordsChangedFields() {
        // given
        Reservation original = confirmed("r-1", "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));
        ReservationPatch patch = ReservationPatch.builder()
                .customerName("Jane Doe")
                .notes("Birthday party")
                .depositPaid(true)
                .build();

        // when
        Reservation updated = original.applyPatch(patch, NOW, "captain");

        // then
        assertThat(updated.notes()).isEqualTo("Birthday party");
        assertThat(updated.depositPaid()).isTrue();
        assertThat(updated.customerName()).isEqualTo("Jane Doe");
        assertThat(updated.createdAt()).isEqualTo(CREATED_AT);
        assertThat(updated.updatedAt()).isEqualTo(NOW);
        assertThat(updated.changeHistory()).singleElement().satisfies(entry -> {
            assertThat(entry.actor()).isEqualTo("captain");
            assertThat(entry.timestamp()).isEqualTo(NOW);
            assertThat(entry.changedFields()).containsExactly("notes", "depositPaid");
        });
        assertThat(original.changeHistory()).isEmpty();
    }

    @Test
    @DisplayName("부분 변경 - 바뀐 값이 없으면 같은 인스턴스를 반환한다")
    void applyPatch_NoChange() {
        Reservation original = confirmed("r-1", "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));

        Reservation result = original.applyPatch(ReservationPatch.builder().status(ReservationStatus.CONFIRMED).build(),
                NOW, "captain");

        assertThat(result).isSameAs(original);
    }

    @Test
    @DisplayName("부분 변경 - 변경 이력은 최근 50건만 유지한다")
    void applyPatch_CapsHistory() {
        // given
        Reservation reservation = confirmed("r-1", "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));

        // when
        for (int i = 0; i < Reservation.MAX_CHANGE_HISTORY + 5; i++) {
            reservation = reservation.applyPatch(ReservationPatch.builder().notes("note-" + i).build(),
                    NOW.plusSeconds(i), "actor-" + i);
        }

        // then
        List<ChangeHistoryEntry> history = reservation.changeHistory();
        assertThat(history).hasSize(Reservation.MAX_CHANGE_HISTORY);
        assertThat(history.get(0).actor()).isEqualTo("actor-5");
        assertThat(history.get(history.size() - 1).actor()).isEqualTo("actor-54");
    }

    @Test
    @DisplayName("이동 변경은 요트와 기간만 바꾼다")
    void applyPatch_Move() {
        Reservation original = confirmed("r-1", "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));
        MoveTarget target = new MoveTarget("alrisha",
                LocalDate.of(2025, 6, 20).atTime(9, 0), LocalDate.of(2025, 6, 22).atTime(17, 0));

        Reservation moved = original.applyPatch(ReservationPatch.moveTo(target), NOW, "captain");

        assertThat(moved.resourceId()).isEqualTo("alrisha");
        assertThat(moved.startDate()).isEqualTo(LocalDate.of(2025, 6, 20));
        assertThat(moved.endDate()).isEqualTo(LocalDate.of(2025, 6, 22));
        assertThat(moved.customerEmail()).isEqualTo(original.customerEmail());
        assertThat(moved.changeHistory()).singleElement()
                .satisfies(entry -> assertThat(entry.changedFields())
                        .containsExactly("resourceId", "startDateTime", "endDateTime"));
    }

    @Test
    @DisplayName("점유 판정은 시작일과 종료일을 포함한다")
    void occupies_Inclusive() {
        Reservation reservation = confirmed("r-1", "spectre", LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12));

        assertThat(reservation.occupies(LocalDate.of(2025, 6, 10))).isTrue();
        assertThat(reservation.occupies(LocalDate.of(2025, 6, 12))).isTrue();
        assertThat(reservation.occupies(LocalDate.of(2025, 6, 13))).isFalse();
        assertThat(reservation.isBoundary(LocalDate.of(2025, 6, 11))).isFalse();
    }
}
