package personal.yacht.charter.booking.domain.service;

import org.springframework.stereotype.Component;
import personal.yacht.charter.booking.domain.model.Reservation;
import personal.yacht.charter.booking.domain.model.ReservationType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 예약 필드 검증
 * 오류가 없으면 빈 맵을 반환한다.
 */
@Component
public class ReservationValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    public Map<String, String> validate(Reservation reservation) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (isBlank(reservation.resourceId())) {
            errors.put("resourceId", "Yacht selection is required");
        }
        // 차단/정비/선주 사용은 고객 정보가 없다
        if (reservation.type() == ReservationType.CHARTER) {
            if (isBlank(reservation.customerName())) {
                errors.put("customerName", "Customer name is required");
            }
            if (isBlank(reservation.customerEmail())) {
                errors.put("customerEmail", "Customer email is required");
            } else if (!EMAIL.matcher(reservation.customerEmail()).matches()) {
                errors.put("customerEmail", "Invalid email format");
            }
        }
        if (reservation.startDateTime() == null) {
            errors.put("startDateTime", "Start date is required");
        }
        if (reservation.endDateTime() == null) {
            errors.put("endDateTime", "End date is required");
        }
        if (reservation.startDateTime() != null && reservation.endDateTime() != null
                && !reservation.endDateTime().isAfter(reservation.startDateTime())) {
            errors.put("endDateTime", "End date must be after start date");
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
