package vgs;

import com.google.common.collect.ImmutableList;

final class GameRules {

  // register-mod-weapon: CustomWeaponData field per input, input_1 through input_12.
  private static final ImmutableList<String> WEAPON_DATA_FIELDS =
      ImmutableList.of(
          "className",
          "name",
          "hudIcon",
          "weaponType",
          "pickupSound1p",
          "pickupSound3p",
          "tier",
          "baseMods",
          "supportedAttachments",
          "lowWeaponChance",
          "medWeaponChance",
          "highWeaponChance");

  static void register(StatementEmitter.Builder builder) {
    // Damage
    builder.register(
        "entity-take-damage",
        NodeRule.statement(
            "%1$s.TakeDamage(%4$s, %2$s, %3$s, { damageType = %5$s })",
            "input_1",
            "input_2",
            "input_3",
            "input_4",
            "input_5"));
    builder.register(
        "radius-damage",
        NodeRule.statement(
            "RadiusDamage(%s, %s, %s, %s, %s)",
            "input_1",
            "input_2",
            "input_3",
            "input_4",
            "input_5"));

    // Entity
    builder.register("get-origin", NodeRule.local("origin", "%s.GetOrigin()", "input_0"));
    builder.register("set-origin", NodeRule.statement("%s.SetOrigin(%s)", "input_1", "input_2"));
    builder.register("get-velocity", NodeRule.local("velocity", "%s.GetVelocity()", "input_0"));
    builder.register(
        "set-velocity", NodeRule.statement("%s.SetVelocity(%s)", "input_1", "input_2"));
    builder.register("get-health", NodeRule.local("health", "%s.GetHealth()", "input_0"));
    builder.register("set-health", NodeRule.statement("%s.SetHealth(%s)", "input_1", "input_2"));
    builder.register("get-owner", NodeRule.local("owner", "%s.GetOwner()", "input_0"));
    builder.register("is-valid", NodeRule.local("isValid", "IsValid(%s)", "input_0"));
    builder.register("is-alive", NodeRule.local("isAlive", "IsAlive(%s)", "input_0"));
    builder.register("kill-entity", NodeRule.statement("%s.Kill()", "input_1"));
    builder.register(
        "get-weapon-owner", NodeRule.local("owner", "%s.GetWeaponOwner()", "input_0"));
    builder.register("register-mod-weapon", GameRules::registerModWeapon);

    // Weapons
    builder.register(
        "get-active-weapon", NodeRule.local("weapon", "%s.GetActiveWeapon()", "input_0"));
    builder.register("fire-weapon-bullet", NodeRule.statement("%s.FireWeaponBullet()", "input_1"));
    builder.register(
        NodeRule.statement("%s.GiveWeapon(%s)", "input_1", "input_2"),
        "give-weapon",
        "give-weapon-action");
    builder.register("precache-weapon", NodeRule.statement("PrecacheWeapon(%s)", "input_1"));

    // Audio
    builder.register(
        NodeRule.statement("EmitSoundOnEntity(%s, %s)", "input_1", "input_2"),
        "emit-sound-on-entity",
        "emit-sound");

    // Particles
    builder.register("start-particle-on-entity", GameRules::startParticleOnEntity);

    // Utilities
    builder.register("print", NodeRule.statement("print(%s)", "input_1"));
    builder.register("get-all-players", NodeRule.local("players", "GetPlayerArray()"));
  }

  private static void registerModWeapon(CompilationContext ctx, Graph.Node node)
      throws CompilerException {
    ImmutableList.Builder<String> values = ImmutableList.builder();
    for (int i = 0; i < WEAPON_DATA_FIELDS.size(); i++) {
      values.add(ctx.valueOf(node, "input_" + (i + 1)));
    }
    String registerInLoot = ctx.valueOf(node, "input_13");

    String data = ctx.newName("weaponData");
    ctx.line("CustomWeaponData %s", data);
    ImmutableList<String> fieldValues = values.build();
    for (int i = 0; i < WEAPON_DATA_FIELDS.size(); i++) {
      ctx.line("%s.%s = %s", data, WEAPON_DATA_FIELDS.get(i), fieldValues.get(i));
    }
    ctx.line("RegisterModWeapon(%s, %s)", data, registerInLoot);
    ctx.followExec(node, "output_0");
  }

  // Exec continues through output_0; the effect handle is output_1.
  private static void startParticleOnEntity(CompilationContext ctx, Graph.Node node)
      throws CompilerException {
    String entity = ctx.valueOf(node, "input_1");
    String effect = ctx.valueOf(node, "input_2");
    String attachment = ctx.valueOf(node, "input_3");
    String handle = ctx.newName("fxHandle");
    ctx.define(node, "output_1", handle);
    ctx.line(
        "local %s = StartParticleEffectOnEntity(%s, GetParticleSystemIndex(%s), "
            + "FX_PATTACH_POINT_FOLLOW, %s)",
        handle,
        entity,
        effect,
        attachment);
    ctx.followExec(node, "output_0");
  }

  private GameRules() {}
}
