package com.example.quotagate.burst;

/**
 * 共有カウンタストア (Redis) が死んだときに、バーストリミッターがどう振る舞うか。
 *
 * FALLBACK:
 *   インスタンス内のスライディングウィンドウで数える。各インスタンスは自分に来た分しか
 *   数えないので、N インスタンスに分散したアカウントは1ウィンドウで最大 N * limit まで通る。
 *   月間台帳は正確なままなので、この劣化は許容する。
 *
 * OPEN:
 *   数えずに許可 = ユーザー体験優先
 *
 * CLOSED:
 *   ストアが戻るまで拒否 = 濫用対策優先 (障害中は全アカウントが弾かれる)
 */
public enum FailMode {
    FALLBACK,
    OPEN,
    CLOSED
}
