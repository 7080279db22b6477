package com.ryuqq.verhoeff.core.engine;

import com.ryuqq.verhoeff.core.digit.DigitParser;
import com.ryuqq.verhoeff.core.digit.DigitSequence;
import com.ryuqq.verhoeff.core.outcome.Result;
import com.ryuqq.verhoeff.core.table.VerhoeffTables;

/**
 * Verhoeff 체크섬 계산 및 검증 엔진.
 *
 * <p>두 연산은 같은 축약(fold) 알고리즘을 공유하며, 순열 테이블 위치 오프셋과
 * 마지막 역원 적용 여부만 다릅니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * c = 0
 * for i in 0..n-1 (마지막 자릿수부터, i=0이 마지막 자릿수):
 *     c = D[c][P[(i + offset) mod 8][digit]]
 *
 * compute:  offset = 1, 결과 = INV[c]
 * validate: offset = 0, 결과 = (c == 0)
 * </pre>
 *
 * <p>compute는 아직 존재하지 않는 체크 디지트가 위치 0을 차지할 것을 가정하므로
 * 페이로드의 각 자릿수를 한 칸씩 밀린 위치로 계산합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 상태가 없으므로 여러 스레드에서 공유할 수 있습니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class ChecksumEngine {

    /**
     * 공유 인스턴스.
     */
    public static final ChecksumEngine INSTANCE = new ChecksumEngine();

    private static final int COMPUTE_OFFSET = 1;
    private static final int VALIDATE_OFFSET = 0;

    /**
     * 체크 디지트 계산.
     *
     * @param input 페이로드 자릿수 문자열
     * @return 성공 시 체크 디지트 (0~9), 실패 시 파서 오류 그대로
     * @throws IllegalArgumentException input이 null인 경우
     */
    public Result<Integer> compute(CharSequence input) {
        return DigitParser.parse(input).map(this::checkDigitOf);
    }

    /**
     * 체크 디지트를 포함한 전체 시퀀스 검증.
     *
     * @param input 체크 디지트가 포함된 자릿수 문자열
     * @return 성공 시 유효 여부, 실패 시 파서 오류 그대로
     * @throws IllegalArgumentException input이 null인 경우
     */
    public Result<Boolean> validate(CharSequence input) {
        return DigitParser.parse(input).map(this::isValid);
    }

    /**
     * 파싱된 페이로드의 체크 디지트 계산.
     *
     * @param payload 페이로드
     * @return 체크 디지트 (0~9)
     * @throws IllegalArgumentException payload가 null인 경우
     */
    public int checkDigitOf(DigitSequence payload) {
        return VerhoeffTables.inverse(fold(payload, COMPUTE_OFFSET));
    }

    /**
     * 파싱된 전체 시퀀스 검증.
     *
     * @param digits 체크 디지트를 포함한 시퀀스
     * @return 누적값이 0이면 true
     * @throws IllegalArgumentException digits가 null인 경우
     */
    public boolean isValid(DigitSequence digits) {
        return fold(digits, VALIDATE_OFFSET) == 0;
    }

    private static int fold(DigitSequence digits, int positionOffset) {
        if (digits == null) {
            throw new IllegalArgumentException("digits cannot be null");
        }
        int c = 0;
        for (int i = 0; i < digits.length(); i++) {
            int permuted = VerhoeffTables.permute(i + positionOffset, digits.digitFromEnd(i));
            c = VerhoeffTables.multiply(c, permuted);
        }
        return c;
    }
}
