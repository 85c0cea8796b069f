package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public class V2__seed_listener_keywords extends BaseJavaMigration {
  private static final String BOT = "captcha_replacement";
  private static final String VOICE = "voice_captcha";
  private static final String AGE = "age_verification";

  private record Seed(String keyword, String category, int weight, List<String> tags) {}

  private static final List<Seed> SEEDS = List.of(
      new Seed("bot attack", "pain_signal", 5, List.of(BOT)),
      new Seed("bot traffic", "pain_signal", 5, List.of(BOT)),
      new Seed("bot detection", "pain_signal", 5, List.of(BOT)),
      new Seed("bot mitigation", "pain_signal", 5, List.of(BOT)),
      new Seed("bot protection", "pain_signal", 5, List.of(BOT)),
      new Seed("anti-bot", "pain_signal", 5, List.of(BOT)),
      new Seed("web scraping", "pain_signal", 5, List.of(BOT)),
      new Seed("scraping attack", "pain_signal", 5, List.of(BOT)),
      new Seed("scraper", "pain_signal", 4, List.of(BOT)),
      new Seed("ai crawler", "pain_signal", 5, List.of(BOT)),
      new Seed("automated attack", "pain_signal", 5, List.of(BOT)),
      new Seed("ticket scalping", "pain_signal", 5, List.of(BOT)),
      new Seed("ticket bots", "pain_signal", 5, List.of(BOT)),
      new Seed("scalper bot", "pain_signal", 5, List.of(BOT)),
      new Seed("sneaker bot", "pain_signal", 5, List.of(BOT)),
      new Seed("api abuse", "pain_signal", 5, List.of(BOT)),
      new Seed("captcha", "pain_signal", 3, List.of(BOT, VOICE)),
      new Seed("captcha bypass", "pain_signal", 5, List.of(BOT, VOICE)),
      new Seed("captcha solver", "pain_signal", 5, List.of(BOT, VOICE)),
      new Seed("ddos", "pain_signal", 4, List.of(BOT)),
      new Seed("sms pumping", "pain_signal", 5, List.of(VOICE)),
      new Seed("sim swap", "pain_signal", 5, List.of(VOICE)),
      new Seed("phone verification", "pain_signal", 5, List.of(VOICE)),
      new Seed("fake accounts", "pain_signal", 5, List.of(BOT, VOICE)),
      new Seed("account takeover", "pain_signal", 5, List.of(BOT, VOICE)),
      new Seed("credential stuffing", "pain_signal", 5, List.of(BOT)),
      new Seed("signup fraud", "pain_signal", 5, List.of(BOT, VOICE)),
      new Seed("card testing", "pain_signal", 5, List.of(BOT)),
      new Seed("fake reviews", "pain_signal", 5, List.of(BOT, VOICE)),
      new Seed("voice cloning", "pain_signal", 5, List.of(VOICE)),
      new Seed("age verification", "regulatory", 5, List.of(AGE)),
      new Seed("age gate", "regulatory", 4, List.of(AGE)),
      new Seed("coppa", "regulatory", 5, List.of(AGE)),
      new Seed("kosa", "regulatory", 5, List.of(AGE)),
      new Seed("child safety", "regulatory", 5, List.of(AGE)),
      new Seed("identity verification", "regulatory", 3, List.of(AGE)),
      new Seed("fraud losses", "cost", 3, List.of(BOT, VOICE)),
      new Seed("chargebacks", "cost", 3, List.of(BOT)),
      new Seed("refund abuse", "cost", 3, List.of(BOT, VOICE)),
      new Seed("promo abuse", "cost", 3, List.of(VOICE)),
      new Seed("coupon abuse", "cost", 3, List.of(VOICE)),
      new Seed("datadome", "competitor", 3, List.of(BOT)),
      new Seed("perimeterx", "competitor", 3, List.of(BOT)),
      new Seed("arkose labs", "competitor", 3, List.of(BOT)),
      new Seed("cloudflare turnstile", "competitor", 3, List.of(BOT)),
      new Seed("twilio verify", "competitor", 3, List.of(VOICE)),
      new Seed("yoti", "competitor", 3, List.of(AGE)),
      new Seed("onfido", "competitor", 3, List.of(AGE))
  );

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    Timestamp now = Timestamp.from(Instant.now());
    String sql =
        "INSERT INTO listener_keywords "
            + "(keyword, category, weight, active, product_tags, created_at, updated_at) "
            + "VALUES (?, ?, ?, TRUE, ?, ?, ?)";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      for (Seed seed : SEEDS) {
        if (exists(connection, seed.keyword())) {
          continue;
        }
        ps.setString(1, seed.keyword());
        ps.setString(2, seed.category());
        ps.setInt(3, seed.weight());
        ps.setString(4, toJsonArray(seed.tags()));
        ps.setTimestamp(5, now);
        ps.setTimestamp(6, now);
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private boolean exists(Connection connection, String keyword) throws SQLException {
    try (PreparedStatement ps =
        connection.prepareStatement("SELECT 1 FROM listener_keywords WHERE keyword = ?")) {
      ps.setString(1, keyword);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static String toJsonArray(List<String> values) {
    StringBuilder json = new StringBuilder("[");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append('"').append(values.get(i)).append('"');
    }
    return json.append(']').toString();
  }
}
