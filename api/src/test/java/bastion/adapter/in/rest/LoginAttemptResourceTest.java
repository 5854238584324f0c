package bastion.adapter.in.rest;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;

import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;

@QuarkusTest
@DisplayName("LoginAttemptResource")
class LoginAttemptResourceTest {

    private static String uniqueUser() {
        return "user-" + UUID.randomUUID();
    }

    private static String uniqueIp() {
        final var random = UUID.randomUUID().getLeastSignificantBits();
        return "172.16." + ((random >>> 8) & 0xff) + "." + (random & 0xff);
    }

    private static Map<String, Object> attempt(String username, String ip, boolean success) {
        return Map.of("username", username, "ipAddress", ip, "success", success);
    }

    private static void fail(String username, String ip) {
        given().contentType(ContentType.JSON).body(attempt(username, ip, false)).when().post("/attempts");
    }

    @Nested
    @DisplayName("POST /attempts")
    class RecordAttemptTests {

        @Test
        @DisplayName("should allow failures under the limit and report remaining attempts")
        void shouldAllowUnderLimit() {
            final var user = uniqueUser();
            final var ip = uniqueIp();

            given().contentType(ContentType.JSON)
                    .body(attempt(user, ip, false))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(200)
                    .body("verdict", equalTo("ALLOWED"))
                    .body("locked", equalTo(false))
                    .body("failureCount", equalTo(1))
                    .body("remainingAttempts", equalTo(2));
        }

        @Test
        @DisplayName("should return 429 with Retry-After once the limit is reached")
        void shouldLockAtLimit() {
            final var user = uniqueUser();
            final var ip = uniqueIp();
            fail(user, ip);
            fail(user, ip);

            given().contentType(ContentType.JSON)
                    .body(attempt(user, ip, false))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(429)
                    .header("Retry-After", notNullValue())
                    .body("verdict", equalTo("LOCKED"))
                    .body("reason", equalTo("max_failed_attempts"))
                    .body("message", equalTo("Account locked: too many login attempts."));
        }

        @Test
        @DisplayName("should refuse a correct password while locked")
        void shouldRefuseSuccessWhileLocked() {
            final var user = uniqueUser();
            final var ip = uniqueIp();
            fail(user, ip);
            fail(user, ip);
            fail(user, ip);

            given().contentType(ContentType.JSON)
                    .body(attempt(user, ip, true))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(429);
        }

        @Test
        @DisplayName("should reset the counter on success")
        void shouldResetOnSuccess() {
            final var user = uniqueUser();
            final var ip = uniqueIp();
            fail(user, ip);
            fail(user, ip);

            given().contentType(ContentType.JSON)
                    .body(attempt(user, ip, true))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(200)
                    .body("remainingAttempts", equalTo(3));

            given().contentType(ContentType.JSON)
                    .body(attempt(user, ip, false))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(200)
                    .body("failureCount", equalTo(1));
        }

        @Test
        @DisplayName("should lock blacklisted IPs")
        void shouldLockBlacklisted() {
            given().contentType(ContentType.JSON)
                    .body(attempt(uniqueUser(), "10.6.6.6", true))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(429)
                    .body("reason", equalTo("ip_blacklisted"));
        }

        @Test
        @DisplayName("should never lock whitelisted IPs")
        void shouldNotLockWhitelisted() {
            final var user = uniqueUser();
            for (int i = 0; i < 5; i++) {
                given().contentType(ContentType.JSON)
                        .body(attempt(user, "10.9.9.9", false))
                        .when()
                        .post("/attempts")
                        .then()
                        .statusCode(200)
                        .body("reason", equalTo("ip_whitelisted"));
            }
        }

        @Test
        @DisplayName("should reject a missing body")
        void shouldRejectMissingBody() {
            given().contentType(ContentType.JSON).when().post("/attempts").then().statusCode(400);
        }
    }

    @Nested
    @DisplayName("GET /attempts/status")
    class StatusTests {

        @Test
        @DisplayName("should not count the check as a failure")
        void shouldNotCount() {
            final var user = uniqueUser();
            final var ip = uniqueIp();
            fail(user, ip);

            for (int i = 0; i < 3; i++) {
                given().queryParam("username", user)
                        .queryParam("ip", ip)
                        .when()
                        .get("/attempts/status")
                        .then()
                        .statusCode(200)
                        .body("failureCount", equalTo(1));
            }
        }

        @Test
        @DisplayName("should report a locked scope")
        void shouldReportLocked() {
            final var user = uniqueUser();
            final var ip = uniqueIp();
            fail(user, ip);
            fail(user, ip);
            fail(user, ip);

            given().queryParam("username", user)
                    .queryParam("ip", ip)
                    .when()
                    .get("/attempts/status")
                    .then()
                    .statusCode(429)
                    .body("locked", equalTo(true));
        }
    }

    @Nested
    @DisplayName("POST /attempts/logout")
    class LogoutTests {

        @Test
        @DisplayName("should mark the pair trusted after a full session")
        void shouldTrustAfterSession() {
            final var user = uniqueUser();
            final var ip = uniqueIp();

            given().contentType(ContentType.JSON)
                    .body(attempt(user, ip, true))
                    .when()
                    .post("/attempts")
                    .then()
                    .statusCode(200)
                    .body("trusted", equalTo(false));

            given().contentType(ContentType.JSON)
                    .body(Map.of("username", user, "ipAddress", ip))
                    .when()
                    .post("/attempts/logout")
                    .then()
                    .statusCode(204);

            given().queryParam("username", user)
                    .queryParam("ip", ip)
                    .when()
                    .get("/attempts/status")
                    .then()
                    .statusCode(200)
                    .body("trusted", equalTo(true));
        }

        @Test
        @DisplayName("should require a username")
        void shouldRequireUsername() {
            given().contentType(ContentType.JSON)
                    .body(Map.of("username", " ", "ipAddress", "10.0.0.1"))
                    .when()
                    .post("/attempts/logout")
                    .then()
                    .statusCode(400);
        }
    }
}
