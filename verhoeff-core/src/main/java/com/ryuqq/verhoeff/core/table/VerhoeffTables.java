package com.ryuqq.verhoeff.core.table;

/**
 * Verhoeff 알고리즘의 세 가지 고정 조회 테이블.
 *
 * <p>모든 테이블은 클래스 로딩 시 한 번 초기화되며 이후 변경되지 않습니다.
 * 배열은 외부로 노출되지 않고 조회 메서드를 통해서만 접근할 수 있으므로
 * 여러 스레드에서 동기화 없이 공유해도 안전합니다.</p>
 *
 * <p><strong>테이블 구성:</strong></p>
 * <ul>
 *   <li>D (10x10): 정이면체군 D5의 곱셈 테이블</li>
 *   <li>P (8x10): 위치별 순열 테이블, 행 0은 항등 순열</li>
 *   <li>INV (10): D에 대한 역원 테이블, {@code D[x][INV[x]] == 0}</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 값을 하나라도 바꾸면 오류 검출 보장이 모두 깨집니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class VerhoeffTables {

    /**
     * 순열 테이블의 주기 (P 행 개수).
     */
    public static final int PERMUTATION_CYCLE = 8;

    private static final int[][] D = {
        {0, 1, 2, 3, 4, 5, 6, 7, 8, 9},
        {1, 2, 3, 4, 0, 6, 7, 8, 9, 5},
        {2, 3, 4, 0, 1, 7, 8, 9, 5, 6},
        {3, 4, 0, 1, 2, 8, 9, 5, 6, 7},
        {4, 0, 1, 2, 3, 9, 5, 6, 7, 8},
        {5, 9, 8, 7, 6, 0, 4, 3, 2, 1},
        {6, 5, 9, 8, 7, 1, 0, 4, 3, 2},
        {7, 6, 5, 9, 8, 2, 1, 0, 4, 3},
        {8, 7, 6, 5, 9, 3, 2, 1, 0, 4},
        {9, 8, 7, 6, 5, 4, 3, 2, 1, 0}
    };

    private static final int[][] P = {
        {0, 1, 2, 3, 4, 5, 6, 7, 8, 9},
        {1, 5, 7, 6, 2, 8, 3, 0, 9, 4},
        {5, 8, 0, 3, 7, 9, 6, 1, 4, 2},
        {8, 9, 1, 6, 0, 4, 3, 5, 2, 7},
        {9, 4, 5, 3, 1, 2, 6, 8, 7, 0},
        {4, 2, 8, 6, 5, 7, 3, 9, 0, 1},
        {2, 7, 9, 3, 8, 0, 6, 4, 1, 5},
        {7, 0, 4, 6, 9, 1, 3, 2, 5, 8}
    };

    private static final int[] INV = {0, 4, 3, 2, 1, 5, 6, 7, 8, 9};

    private VerhoeffTables() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * D5 곱셈.
     *
     * @param a 현재 누적값 (0~9)
     * @param b 순열이 적용된 자릿수 (0~9)
     * @return {@code D[a][b]} (0~9)
     * @throws IllegalArgumentException 인자가 0~9 범위를 벗어난 경우
     */
    public static int multiply(int a, int b) {
        requireDigit(a, "a");
        requireDigit(b, "b");
        return D[a][b];
    }

    /**
     * 위치별 순열 적용.
     *
     * <p>position은 {@link #PERMUTATION_CYCLE}로 나눈 나머지로 행을 선택합니다.</p>
     *
     * @param position 끝에서부터의 거리 (0 이상)
     * @param digit 자릿수 (0~9)
     * @return {@code P[position mod 8][digit]}
     * @throws IllegalArgumentException position이 음수이거나 digit이 범위를 벗어난 경우
     */
    public static int permute(int position, int digit) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative (current: " + position + ")");
        }
        requireDigit(digit, "digit");
        return P[position % PERMUTATION_CYCLE][digit];
    }

    /**
     * D에 대한 역원.
     *
     * @param x 자릿수 (0~9)
     * @return {@code D[x][y] == 0}을 만족하는 유일한 y
     * @throws IllegalArgumentException x가 범위를 벗어난 경우
     */
    public static int inverse(int x) {
        requireDigit(x, "x");
        return INV[x];
    }

    private static void requireDigit(int value, String name) {
        if (value < 0 || value > 9) {
            throw new IllegalArgumentException(name + " must be between 0 and 9 (current: " + value + ")");
        }
    }
}
